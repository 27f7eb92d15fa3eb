package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Prefix operator application, e.g. {@code not x} or {@code -n}. */
public record UnaryOp(OperatorCategory category, String operator, MetaNode operand, NodeMeta meta)
        implements MetaNode {

    public UnaryOp {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.UNARY_OP;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(operand);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
