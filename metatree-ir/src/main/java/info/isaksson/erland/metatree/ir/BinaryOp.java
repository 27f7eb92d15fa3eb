package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Binary operator application, e.g. {@code x + 5}. */
public record BinaryOp(OperatorCategory category, String operator, MetaNode left, MetaNode right, NodeMeta meta)
        implements MetaNode {

    public BinaryOp {
        meta = NodeLists.meta(meta);
    }

    public static BinaryOp of(OperatorCategory category, String operator, MetaNode left, MetaNode right) {
        return new BinaryOp(category, operator, left, right, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.BINARY_OP;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(left, right);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
