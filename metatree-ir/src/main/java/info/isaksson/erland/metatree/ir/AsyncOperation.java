package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Await of, or asynchronous launch of, an operation. */
public record AsyncOperation(AsyncKind kind, MetaNode operation, NodeMeta meta) implements MetaNode {

    public AsyncOperation {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.ASYNC_OPERATION;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(operation);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitAsyncOperation(this);
    }
}
