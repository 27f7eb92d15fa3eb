package info.isaksson.erland.metatree.ir;

/**
 * Conformance tiers of the meta-tree grammar, ordered from "every language has this" to
 * "opaque, language-specific".
 *
 * <p>Ordering matters: the level of a tree is the deepest tier used anywhere in it.</p>
 */
public enum Tier {
    /** Tier-1: literals, variables, operators, calls, conditionals, blocks, collections. */
    CORE,
    /** Tier-2: loops, lambdas, collection transforms, pattern matching, exceptions, async. */
    EXTENDED,
    /** Tier-2s: containers, function definitions, parameters, attribute access, properties. */
    STRUCTURAL,
    /** Tier-3: native escape hatch. */
    NATIVE;

    public boolean isDeeperThan(Tier other) {
        return other == null || ordinal() > other.ordinal();
    }

    public static Tier deepest(Tier a, Tier b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public String wireName() {
        return WireNames.of(this);
    }
}
