package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Named property with optional getter and setter bodies. */
public record Property(String name, MetaNode getter, MetaNode setter, NodeMeta meta) implements MetaNode {

    public Property {
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.PROPERTY;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(getter, setter);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }
}
