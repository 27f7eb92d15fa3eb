package info.isaksson.erland.metatree.ir;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminant of every meta-tree node, together with the tier it belongs to.
 */
public enum NodeTag {
    // Tier-1
    LITERAL(Tier.CORE, true),
    VARIABLE(Tier.CORE, true),
    LIST(Tier.CORE, false),
    MAP(Tier.CORE, false),
    PAIR(Tier.CORE, false),
    TUPLE(Tier.CORE, false),
    BINARY_OP(Tier.CORE, false),
    UNARY_OP(Tier.CORE, false),
    FUNCTION_CALL(Tier.CORE, false),
    CONDITIONAL(Tier.CORE, false),
    EARLY_RETURN(Tier.CORE, false),
    BLOCK(Tier.CORE, false),
    ASSIGNMENT(Tier.CORE, false),
    INLINE_MATCH(Tier.CORE, false),

    // Tier-2
    LOOP(Tier.EXTENDED, false),
    LAMBDA(Tier.EXTENDED, false),
    COLLECTION_OP(Tier.EXTENDED, false),
    PATTERN_MATCH(Tier.EXTENDED, false),
    MATCH_ARM(Tier.EXTENDED, false),
    EXCEPTION_HANDLING(Tier.EXTENDED, false),
    ASYNC_OPERATION(Tier.EXTENDED, false),

    // Tier-2s
    CONTAINER(Tier.STRUCTURAL, false),
    FUNCTION_DEF(Tier.STRUCTURAL, false),
    PARAM(Tier.STRUCTURAL, true),
    ATTRIBUTE_ACCESS(Tier.STRUCTURAL, false),
    AUGMENTED_ASSIGNMENT(Tier.STRUCTURAL, false),
    PROPERTY(Tier.STRUCTURAL, false),

    // Tier-3
    LANGUAGE_SPECIFIC(Tier.NATIVE, true);

    private final Tier tier;
    private final boolean scalarPayload;

    NodeTag(Tier tier, boolean scalarPayload) {
        this.tier = tier;
        this.scalarPayload = scalarPayload;
    }

    public Tier tier() {
        return tier;
    }

    /** True when the payload is a scalar value rather than a list of child nodes. */
    public boolean hasScalarPayload() {
        return scalarPayload;
    }

    public String wireName() {
        return WireNames.of(this);
    }

    /** Lookup by wire name; unknown tags yield an empty result rather than an exception. */
    public static Optional<NodeTag> fromWire(String wire) {
        if (wire == null) return Optional.empty();
        String constant = wire.trim().toUpperCase(Locale.ROOT);
        for (NodeTag t : values()) {
            if (t.name().equals(constant)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
