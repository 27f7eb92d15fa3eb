package info.isaksson.erland.metatree.validate;

import info.isaksson.erland.metatree.ir.Conformance;
import info.isaksson.erland.metatree.ir.Document;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.TreeMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a meta-tree against the grammar, the requested {@link ValidationMode} and
 * {@link ValidationLimits}.
 *
 * <p>Checks run in a fixed order and stop at the first failure: structure, mode, depth, node
 * count, variables. The validator holds no state.</p>
 */
public final class Validator {

    /** Depth above which STRICT and STANDARD add a {@code deep_nesting} warning. */
    public static final int DEEP_NESTING_THRESHOLD = 100;
    /** Node count above which STRICT and STANDARD add a {@code large_tree} warning. */
    public static final int LARGE_TREE_THRESHOLD = 1000;

    public ValidationReport validate(Document document) throws ValidationException {
        return validate(document, ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
    }

    public ValidationReport validate(Document document, ValidationMode mode, ValidationLimits limits)
            throws ValidationException {
        if (document == null) throw new IllegalArgumentException("document is null");
        return validateTree(document.tree(), mode, limits);
    }

    public ValidationReport validateTree(MetaNode tree, ValidationMode mode, ValidationLimits limits)
            throws ValidationException {
        if (mode == null) mode = ValidationMode.STANDARD;
        if (limits == null) limits = ValidationLimits.DEFAULTS;

        if (!Conformance.conforms(tree)) {
            throw new ValidationException(ValidationException.Reason.INVALID_STRUCTURE,
                    tree == null ? "tree is null" : "tree rooted at " + tree.tag().wireName() + " does not conform");
        }

        TreeMetrics m = TreeMetrics.of(tree);

        if (mode == ValidationMode.STRICT && m.nativeCount() > 0) {
            throw new ValidationException(ValidationException.Reason.NATIVE_CONSTRUCT_IN_STRICT_MODE,
                    m.nativeCount() + " language-specific construct(s) not allowed");
        }
        if (m.depth() > limits.maxDepth()) {
            throw new ValidationException(ValidationException.Reason.MAX_DEPTH_EXCEEDED,
                    "depth " + m.depth() + " > " + limits.maxDepth());
        }
        if (m.nodeCount() > limits.maxNodeCount()) {
            throw new ValidationException(ValidationException.Reason.MAX_NODE_COUNT_EXCEEDED,
                    "node count " + m.nodeCount() + " > " + limits.maxNodeCount());
        }
        if (m.distinctVariableCount() > limits.maxVariables()) {
            throw new ValidationException(ValidationException.Reason.MAX_VARIABLES_EXCEEDED,
                    m.distinctVariableCount() + " distinct variables > " + limits.maxVariables());
        }

        return new ValidationReport(m.level(), m.depth(), m.nodeCount(), m.variables(), m.nativeCount(),
                warnings(m, mode));
    }

    public boolean isValid(Document document, ValidationMode mode, ValidationLimits limits) {
        try {
            validate(document, mode, limits);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    private static List<ValidationWarning> warnings(TreeMetrics m, ValidationMode mode) {
        List<ValidationWarning> out = new ArrayList<>();
        if (mode == ValidationMode.PERMISSIVE) return out;
        if (mode == ValidationMode.STANDARD && m.nativeCount() > 0) {
            out.add(ValidationWarning.nativeConstructs(m.nativeCount()));
        }
        if (m.depth() > DEEP_NESTING_THRESHOLD) out.add(ValidationWarning.deepNesting(m.depth()));
        if (m.nodeCount() > LARGE_TREE_THRESHOLD) out.add(ValidationWarning.largeTree(m.nodeCount()));
        return out;
    }
}
