package info.isaksson.erland.metatree.binding;

public class UnparseException extends MetaTreeException {

    public UnparseException(String message) {
        super(message);
    }

    public UnparseException(String message, Throwable cause) {
        super(message, cause);
    }
}
