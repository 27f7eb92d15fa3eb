package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Map/filter/reduce over a collection. {@code initial} is only present for reduce. */
public record CollectionOp(CollectionOpKind kind, MetaNode function, MetaNode collection, MetaNode initial,
                           NodeMeta meta) implements MetaNode {

    public CollectionOp {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.COLLECTION_OP;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(function, collection, initial);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitCollectionOp(this);
    }
}
