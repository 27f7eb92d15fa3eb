package info.isaksson.erland.metatree.ir;

import java.util.Optional;

/**
 * Metadata every node carries on its own. Nothing here is ever inherited from an ancestor.
 */
public record NodeMeta(Location location) {

    public static final NodeMeta EMPTY = new NodeMeta(null);

    public static NodeMeta at(int line, int column) {
        return new NodeMeta(Location.at(line, column));
    }

    public static NodeMeta of(Location location) {
        return location == null ? EMPTY : new NodeMeta(location);
    }

    public Optional<Location> optionalLocation() {
        return Optional.ofNullable(location);
    }

    public NodeMeta withoutLocation() {
        return EMPTY;
    }
}
