package info.isaksson.erland.metatree.binding;

/** A native construct the binding cannot map, not even to an escape node. */
public class AbstractionException extends MetaTreeException {

    private final String construct;

    public AbstractionException(String construct, String message) {
        super("Cannot abstract " + construct + ": " + message);
        this.construct = construct;
    }

    /** Name of the offending native construct, e.g. {@code SwitchExpr}. */
    public String construct() {
        return construct;
    }
}
