package info.isaksson.erland.metatree.validate;

import info.isaksson.erland.metatree.ir.WireNames;

/** Advisory finding that does not fail validation. */
public record ValidationWarning(Code code, int value, String message) {

    public enum Code {
        NATIVE_CONSTRUCTS_PRESENT,
        DEEP_NESTING,
        LARGE_TREE;

        public String wireName() {
            return WireNames.of(this);
        }
    }

    static ValidationWarning nativeConstructs(int count) {
        return new ValidationWarning(Code.NATIVE_CONSTRUCTS_PRESENT, count,
                count + " language-specific construct(s) present");
    }

    static ValidationWarning deepNesting(int depth) {
        return new ValidationWarning(Code.DEEP_NESTING, depth, "nesting depth " + depth + " exceeds " + Validator.DEEP_NESTING_THRESHOLD);
    }

    static ValidationWarning largeTree(int nodeCount) {
        return new ValidationWarning(Code.LARGE_TREE, nodeCount, nodeCount + " nodes exceeds " + Validator.LARGE_TREE_THRESHOLD);
    }
}
