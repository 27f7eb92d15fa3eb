package info.isaksson.erland.metatree.binding;

/** Source text is not valid input for the binding. Line and column are 1-based; 0 when unknown. */
public class ParseException extends MetaTreeException {

    private final int line;
    private final int column;

    public ParseException(int line, int column, String message) {
        super(format(line, column, message));
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    public ParseException(int line, int column, String message, Throwable cause) {
        super(format(line, column, message), cause);
        this.line = Math.max(0, line);
        this.column = Math.max(0, column);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static String format(int line, int column, String message) {
        if (line <= 0) return message;
        return line + ":" + Math.max(0, column) + ": " + message;
    }
}
