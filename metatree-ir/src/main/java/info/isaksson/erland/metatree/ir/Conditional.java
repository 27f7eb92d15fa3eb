package info.isaksson.erland.metatree.ir;

import java.util.List;

/** If/else, ternary or any two-way branch. {@code elseBranch} may be null. */
public record Conditional(MetaNode condition, MetaNode thenBranch, MetaNode elseBranch, NodeMeta meta)
        implements MetaNode {

    public Conditional {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.CONDITIONAL;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(condition, thenBranch, elseBranch);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
