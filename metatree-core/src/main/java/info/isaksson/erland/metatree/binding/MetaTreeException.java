package info.isaksson.erland.metatree.binding;

/**
 * Root of the checked failures a meta-tree pipeline can report. Each stage has its own subtype so
 * callers can tell a parse error from a reification error without inspecting messages.
 */
public abstract class MetaTreeException extends Exception {

    protected MetaTreeException(String message) {
        super(message);
    }

    protected MetaTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
