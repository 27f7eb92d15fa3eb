package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.Conformance;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.MetaNodes;
import info.isaksson.erland.metatree.ir.MetaTreeJson;
import info.isaksson.erland.metatree.ir.MetaTreeNormalizer;
import info.isaksson.erland.metatree.ir.NativeEscape;

/**
 * Reusable checks of the binding obligations, meant to be called from each binding's tests.
 */
public final class BindingContractChecker {

    private BindingContractChecker() {}

    /** One source text taken through abstraction, regeneration and abstraction again. */
    public record RoundTrip(Abstraction first, String regenerated, Abstraction second) {

        /** True when both abstractions have the same structure, locations ignored. */
        public boolean semanticallyEqual() {
            return MetaTreeNormalizer.stripLocations(first.tree())
                    .equals(MetaTreeNormalizer.stripLocations(second.tree()));
        }

        /** True when the regenerated text was read back with the same reconstruction metadata. */
        public boolean sameMetadata() {
            return first.metadata().equals(second.metadata());
        }
    }

    public static <N> Abstraction abstractSource(LanguageBinding<N> binding, String source) throws MetaTreeException {
        return binding.abstractTree(binding.parse(source));
    }

    public static <N> String regenerate(LanguageBinding<N> binding, Abstraction abstraction) throws MetaTreeException {
        return binding.unparse(binding.reify(abstraction.tree(), abstraction.metadata()));
    }

    public static <N> RoundTrip roundTrip(LanguageBinding<N> binding, String source) throws MetaTreeException {
        Abstraction first = abstractSource(binding, source);
        String regenerated = regenerate(binding, first);
        Abstraction second = abstractSource(binding, regenerated);
        return new RoundTrip(first, regenerated, second);
    }

    /**
     * Round trip that fails with an {@link AssertionError} unless both abstractions are equal, the
     * regenerated text is read back as the same kind of unit, and regenerating a second time gives
     * the same text.
     */
    public static <N> RoundTrip assertRoundTrip(LanguageBinding<N> binding, String source) throws MetaTreeException {
        RoundTrip rt = roundTrip(binding, source);
        if (!rt.semanticallyEqual()) {
            throw new AssertionError(binding.language() + " round trip changed the tree of: " + source
                    + "\nregenerated: " + rt.regenerated());
        }
        if (!rt.sameMetadata()) {
            throw new AssertionError(binding.language() + " read the regenerated text differently: "
                    + rt.first().metadata() + " vs " + rt.second().metadata() + "\nregenerated: " + rt.regenerated());
        }
        String again = regenerate(binding, rt.second());
        if (!again.equals(rt.regenerated())) {
            throw new AssertionError(binding.language() + " regeneration is not stable for: " + source
                    + "\nfirst: " + rt.regenerated() + "\nsecond: " + again);
        }
        return rt;
    }

    /**
     * Abstracts {@code source} and fails with an {@link AssertionError} when the result does not
     * conform, or when an escape node does not belong to this binding.
     */
    public static <N> Abstraction assertConformsAfterAbstraction(LanguageBinding<N> binding, String source)
            throws MetaTreeException {
        Abstraction a = abstractSource(binding, source);
        if (!Conformance.conforms(a.tree())) {
            throw new AssertionError(binding.language() + " produced a non-conforming tree for: " + source
                    + "\n" + MetaTreeJson.toJsonString(a.tree()));
        }
        for (NativeEscape e : MetaNodes.nativeEscapes(a.tree())) {
            if (!binding.language().equals(e.language())) {
                throw new AssertionError("Escape node tagged '" + e.language() + "' from binding " + binding.language());
            }
        }
        return a;
    }

    /** Equal trees after stripping locations and normalizing names. */
    public static <A, B> boolean abstractionsEquivalent(LanguageBinding<A> a, String sourceA,
                                                        LanguageBinding<B> b, String sourceB) throws MetaTreeException {
        MetaNode ta = abstractSource(a, sourceA).tree();
        MetaNode tb = abstractSource(b, sourceB).tree();
        return MetaTreeNormalizer.equivalent(ta, tb);
    }
}
