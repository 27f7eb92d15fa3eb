package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Return (or equivalent early exit) with an optional value. */
public record EarlyReturn(MetaNode value, NodeMeta meta) implements MetaNode {

    public EarlyReturn {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.EARLY_RETURN;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(value);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitEarlyReturn(this);
    }
}
