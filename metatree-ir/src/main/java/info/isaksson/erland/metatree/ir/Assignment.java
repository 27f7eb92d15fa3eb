package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Imperative assignment. {@code declaredType} is non-null when the statement also declares the
 * target, and holds the type text the source used (for example {@code var} or {@code int}).
 */
public record Assignment(MetaNode target, MetaNode value, String declaredType, NodeMeta meta) implements MetaNode {

    public Assignment {
        meta = NodeLists.meta(meta);
    }

    public static Assignment of(MetaNode target, MetaNode value) {
        return new Assignment(target, value, null, NodeMeta.EMPTY);
    }

    public boolean isDeclaration() {
        return declaredType != null;
    }

    @Override public NodeTag tag() {
        return NodeTag.ASSIGNMENT;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(target, value);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
