package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Key/value entry of a {@link MapNode}. */
public record Pair(MetaNode key, MetaNode value, NodeMeta meta) implements MetaNode {

    public Pair {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.PAIR;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(key, value);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitPair(this);
    }
}
