package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Map literal; entries keep source order. */
public record MapNode(List<Pair> entries, NodeMeta meta) implements MetaNode {

    public MapNode {
        entries = NodeLists.freeze(entries);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.MAP;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(entries);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
