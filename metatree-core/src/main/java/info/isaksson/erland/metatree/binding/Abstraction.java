package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.MetaNode;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of {@link LanguageBinding#abstractTree}: the meta-tree plus whatever the binding needs to
 * reconstruct native form later and cannot express structurally.
 */
public record Abstraction(MetaNode tree, Map<String, String> metadata) {

    public Abstraction {
        if (tree == null) throw new IllegalArgumentException("tree is null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public static Abstraction of(MetaNode tree) {
        return new Abstraction(tree, Map.of());
    }
}
