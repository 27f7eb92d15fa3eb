package info.isaksson.erland.metatree.ir;

import java.util.Locale;

/**
 * Produces comparison-friendly copies of meta-trees.
 *
 * <p>Two bindings that abstract the same program under different naming conventions
 * ({@code user_count} vs {@code UserCount} vs {@code userCount}) produce equal trees once
 * locations are stripped and names are folded with {@link #foldName(String)}.</p>
 *
 * <p>Child order is never changed; only metadata and names are rewritten.</p>
 */
public final class MetaTreeNormalizer {

    private MetaTreeNormalizer() {}

    /** Copy without any {@link Location}. */
    public static MetaNode stripLocations(MetaNode root) {
        return new MetaNodeRewriter() {
            @Override protected NodeMeta meta(NodeMeta meta) {
                return NodeMeta.EMPTY;
            }
        }.rewrite(root);
    }

    /** Copy with variable and parameter names folded. */
    public static MetaNode foldNames(MetaNode root) {
        return new MetaNodeRewriter() {
            @Override protected String variableName(String name) {
                return foldName(name);
            }

            @Override protected String paramName(String name) {
                return foldName(name);
            }
        }.rewrite(root);
    }

    /** Copy without boundary contexts. */
    public static MetaNode stripBoundaryContexts(MetaNode root) {
        return new MetaNodeRewriter() {
            @Override protected BoundaryContext context(BoundaryContext context) {
                return BoundaryContext.EMPTY;
            }
        }.rewrite(root);
    }

    /** Locations stripped and names folded: the form cross-binding equality is defined on. */
    public static MetaNode forComparison(MetaNode root) {
        return new MetaNodeRewriter() {
            @Override protected NodeMeta meta(NodeMeta meta) {
                return NodeMeta.EMPTY;
            }

            @Override protected String variableName(String name) {
                return foldName(name);
            }

            @Override protected String paramName(String name) {
                return foldName(name);
            }
        }.rewrite(root);
    }

    public static boolean equivalent(MetaNode a, MetaNode b) {
        if (a == null || b == null) return a == b;
        return forComparison(a).equals(forComparison(b));
    }

    /** Lower-cases and drops underscores, so snake, camel and capitalized spellings coincide. */
    public static String foldName(String name) {
        if (name == null) return null;
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
