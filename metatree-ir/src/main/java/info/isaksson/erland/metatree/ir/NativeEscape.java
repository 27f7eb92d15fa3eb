package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Tier-3 escape hatch: an opaque native fragment from {@code language}, plus a semantic hint
 * (e.g. {@code switch_statement}). Only the originating binding interprets {@code payload}.
 */
public record NativeEscape(String language, String hint, String payload, NodeMeta meta) implements MetaNode {

    public NativeEscape {
        meta = NodeLists.meta(meta);
    }

    public static NativeEscape of(String language, String hint, String payload) {
        return new NativeEscape(language, hint, payload, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.LANGUAGE_SPECIFIC;
    }

    @Override public List<MetaNode> children() {
        return List.of();
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitNativeEscape(this);
    }
}
