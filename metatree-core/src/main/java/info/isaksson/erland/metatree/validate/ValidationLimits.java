package info.isaksson.erland.metatree.validate;

/**
 * Hard resource limits. Exceeding any of them fails validation with its own reason.
 */
public record ValidationLimits(int maxDepth, int maxNodeCount, int maxVariables) {

    public static final int DEFAULT_MAX_DEPTH = 1000;
    public static final int DEFAULT_MAX_NODE_COUNT = 1_000_000;
    public static final int DEFAULT_MAX_VARIABLES = 10_000;

    public static final ValidationLimits DEFAULTS =
            new ValidationLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODE_COUNT, DEFAULT_MAX_VARIABLES);

    public ValidationLimits {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        if (maxNodeCount < 1) throw new IllegalArgumentException("maxNodeCount must be >= 1");
        if (maxVariables < 0) throw new IllegalArgumentException("maxVariables must be >= 0");
    }

    public ValidationLimits withMaxDepth(int value) {
        return new ValidationLimits(value, maxNodeCount, maxVariables);
    }

    public ValidationLimits withMaxNodeCount(int value) {
        return new ValidationLimits(maxDepth, value, maxVariables);
    }

    public ValidationLimits withMaxVariables(int value) {
        return new ValidationLimits(maxDepth, maxNodeCount, value);
    }
}
