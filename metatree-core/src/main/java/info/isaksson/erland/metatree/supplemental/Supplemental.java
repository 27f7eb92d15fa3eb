package info.isaksson.erland.metatree.supplemental;

import info.isaksson.erland.metatree.ir.MetaNode;

import java.util.Map;
import java.util.Optional;

/**
 * Rewrites constructs a target language has no native form for into ones its binding can reify,
 * usually calls into a library of that language.
 *
 * <p>Implementations are discovered through
 * {@code META-INF/services/info.isaksson.erland.metatree.supplemental.Supplemental} and must be
 * stateless.</p>
 */
public interface Supplemental {

    SupplementalInfo info();

    /**
     * Replacement for {@code node}, whose children have already been rewritten, or empty when this
     * particular occurrence cannot be handled.
     */
    Optional<MetaNode> transform(MetaNode node, String language, Map<String, String> metadata);
}
