package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Fixed-size heterogeneous tuple. */
public record TupleNode(List<MetaNode> elements, NodeMeta meta) implements MetaNode {

    public TupleNode {
        elements = NodeLists.freeze(elements);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.TUPLE;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(elements);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }
}
