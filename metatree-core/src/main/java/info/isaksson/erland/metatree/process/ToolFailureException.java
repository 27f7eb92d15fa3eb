package info.isaksson.erland.metatree.process;

import info.isaksson.erland.metatree.binding.MetaTreeException;

/** Carries a {@link ToolFailure} out of {@link ExternalToolExchange#call}. */
public class ToolFailureException extends MetaTreeException {

    private final ToolFailure failure;

    public ToolFailureException(ToolFailure failure) {
        super(failure.kind() + " " + failure.describe());
        this.failure = failure;
    }

    public ToolFailureException(ToolFailure failure, Throwable cause) {
        super(failure.kind() + " " + failure.describe(), cause);
        this.failure = failure;
    }

    public ToolFailure failure() {
        return failure;
    }
}
