package info.isaksson.erland.metatree.supplemental;

import info.isaksson.erland.metatree.ir.NodeTag;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * What a {@link Supplemental} offers: the target language and the node kinds it can rewrite into
 * forms that language's binding reifies.
 *
 * @param name        unique name, used to unregister
 * @param language    target language tag
 * @param constructs  node kinds handled; never empty
 * @param requires    libraries the rewritten code depends on, for diagnostics only
 * @param description free text, may be empty
 */
public record SupplementalInfo(String name, String language, Set<NodeTag> constructs, List<String> requires,
                               String description) {

    public SupplementalInfo {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("supplemental name is blank");
        if (language == null || language.isBlank()) throw new IllegalArgumentException("supplemental language is blank");
        if (constructs == null || constructs.isEmpty()) {
            throw new IllegalArgumentException("supplemental " + name + " handles no constructs");
        }
        language = language.trim().toLowerCase(Locale.ROOT);
        constructs = Set.copyOf(constructs);
        requires = requires == null ? List.of() : List.copyOf(requires);
        description = description == null ? "" : description;
    }
}
