package info.isaksson.erland.metatree.ir;

/**
 * Source position of a node. Zero means "unknown" for any of the four coordinates.
 */
public record Location(int line, int column, int endLine, int endColumn) {

    public Location {
        if (line < 0 || column < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException("Location coordinates must be >= 0");
        }
    }

    public static Location at(int line, int column) {
        return new Location(line, column, 0, 0);
    }

    @Override public String toString() {
        if (endLine == 0) return line + ":" + column;
        return line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
