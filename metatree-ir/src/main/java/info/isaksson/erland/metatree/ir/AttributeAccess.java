package info.isaksson.erland.metatree.ir;

import java.util.List;

/** {@code receiver.attribute}. */
public record AttributeAccess(MetaNode receiver, String attribute, NodeMeta meta) implements MetaNode {

    public AttributeAccess {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.ATTRIBUTE_ACCESS;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(receiver);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitAttributeAccess(this);
    }
}
