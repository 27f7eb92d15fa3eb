package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Ordered list literal. */
public record ListNode(List<MetaNode> elements, NodeMeta meta) implements MetaNode {

    public ListNode {
        elements = NodeLists.freeze(elements);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.LIST;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(elements);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
