package info.isaksson.erland.metatree.ir;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * A conforming meta-tree together with the language it was abstracted from, a key-ordered metadata
 * side-channel and, optionally, the original source text.
 *
 * <p>Instances are immutable. The factories reject trees for which {@link Conformance#conforms}
 * is false, so holding a {@code Document} means holding a conforming tree.</p>
 */
public final class Document {

    private final MetaNode tree;
    private final String language;
    private final SortedMap<String, String> metadata;
    private final String originalSource;

    private Document(MetaNode tree, String language, SortedMap<String, String> metadata, String originalSource) {
        this.tree = tree;
        this.language = language;
        this.metadata = metadata;
        this.originalSource = originalSource;
    }

    public static Document of(MetaNode tree, String language) {
        return of(tree, language, Map.of(), null);
    }

    public static Document of(MetaNode tree, String language, Map<String, String> metadata, String originalSource) {
        if (tree == null) throw new IllegalArgumentException("tree is null");
        if (language == null || language.isBlank()) throw new IllegalArgumentException("language is blank");
        if (!Conformance.conforms(tree)) throw new NonConformingTreeException(tree.tag());
        return new Document(tree, language, copy(metadata), originalSource);
    }

    public MetaNode tree() {
        return tree;
    }

    public String language() {
        return language;
    }

    /** Unmodifiable, ordered by key. */
    public SortedMap<String, String> metadata() {
        return metadata;
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public Optional<String> originalSource() {
        return Optional.ofNullable(originalSource);
    }

    /** Same language and metadata, new tree. The original source no longer describes the tree and is dropped. */
    public Document withTree(MetaNode newTree) {
        if (newTree == null) throw new IllegalArgumentException("tree is null");
        if (!Conformance.conforms(newTree)) throw new NonConformingTreeException(newTree.tag());
        return new Document(newTree, language, metadata, null);
    }

    /** Adds or replaces metadata entries; existing keys not mentioned are kept. */
    public Document withMetadata(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) return this;
        TreeMap<String, String> merged = new TreeMap<>(metadata);
        extra.forEach((k, v) -> {
            if (k == null) throw new IllegalArgumentException("metadata key is null");
            if (v == null) merged.remove(k);
            else merged.put(k, v);
        });
        return new Document(tree, language, Collections.unmodifiableSortedMap(merged), originalSource);
    }

    public Tier level() {
        return Conformance.level(tree);
    }

    public SortedSet<String> variables() {
        return MetaNodes.variables(tree);
    }

    /** Tree equality with locations ignored. Language, metadata and source are not compared. */
    public static boolean equivalent(Document a, Document b) {
        if (a == null || b == null) return a == b;
        return MetaTreeNormalizer.stripLocations(a.tree).equals(MetaTreeNormalizer.stripLocations(b.tree));
    }

    private static SortedMap<String, String> copy(Map<String, String> in) {
        TreeMap<String, String> out = new TreeMap<>();
        if (in != null) {
            in.forEach((k, v) -> {
                if (k == null || v == null) throw new IllegalArgumentException("metadata entries must be non-null");
                out.put(k, v);
            });
        }
        return Collections.unmodifiableSortedMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        Document other = (Document) o;
        return tree.equals(other.tree)
                && language.equals(other.language)
                && metadata.equals(other.metadata)
                && Objects.equals(originalSource, other.originalSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tree, language, metadata, originalSource);
    }

    @Override
    public String toString() {
        return "Document{language=" + language + ", level=" + level().wireName() + ", metadata=" + metadata + "}";
    }
}
