package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Compound assignment such as {@code total += x}; {@code operator} is the binary part ({@code +}). */
public record AugmentedAssignment(OperatorCategory category, String operator, MetaNode target, MetaNode value,
                                  NodeMeta meta) implements MetaNode {

    public AugmentedAssignment {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.AUGMENTED_ASSIGNMENT;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(target, value);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitAugmentedAssignment(this);
    }
}
