package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Declarative pattern binding, e.g. {@code {a, b} = pair}. */
public record InlineMatch(MetaNode pattern, MetaNode value, NodeMeta meta) implements MetaNode {

    public InlineMatch {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.INLINE_MATCH;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(pattern, value);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitInlineMatch(this);
    }
}
