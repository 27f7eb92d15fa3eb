package info.isaksson.erland.metatree.ir;

import java.io.IOException;

/** Malformed serialized meta-tree: unknown tag, wrong payload arity, bad scalar. */
public class MetaTreeFormatException extends IOException {

    private final String path;

    public MetaTreeFormatException(String path, String message) {
        super((path == null || path.isEmpty() ? "$" : path) + ": " + message);
        this.path = path == null || path.isEmpty() ? "$" : path;
    }

    /** JSON path of the offending value, e.g. {@code $.tree.payload[1]}. */
    public String path() {
        return path;
    }
}
