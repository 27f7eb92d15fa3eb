package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Reference to a named variable. */
public record Variable(String name, NodeMeta meta) implements MetaNode {

    public Variable {
        meta = NodeLists.meta(meta);
    }

    public static Variable named(String name) {
        return new Variable(name, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.VARIABLE;
    }

    @Override public List<MetaNode> children() {
        return List.of();
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
