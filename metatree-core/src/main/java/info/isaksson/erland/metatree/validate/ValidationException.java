package info.isaksson.erland.metatree.validate;

import info.isaksson.erland.metatree.binding.MetaTreeException;
import info.isaksson.erland.metatree.ir.WireNames;

/** Validation failed; {@link #reason()} says which rule. */
public class ValidationException extends MetaTreeException {

    public enum Reason {
        INVALID_STRUCTURE,
        MAX_DEPTH_EXCEEDED,
        MAX_NODE_COUNT_EXCEEDED,
        MAX_VARIABLES_EXCEEDED,
        NATIVE_CONSTRUCT_IN_STRICT_MODE;

        public String wireName() {
            return WireNames.of(this);
        }
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(reason.wireName() + ": " + message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
