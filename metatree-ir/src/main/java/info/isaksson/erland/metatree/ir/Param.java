package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Formal parameter, with optional type hint, default value and destructuring pattern. */
public record Param(String name, String typeHint, MetaNode defaultValue, MetaNode pattern, NodeMeta meta)
        implements MetaNode {

    public Param {
        meta = NodeLists.meta(meta);
    }

    public static Param named(String name) {
        return new Param(name, null, null, null, NodeMeta.EMPTY);
    }

    public static Param typed(String name, String typeHint) {
        return new Param(name, typeHint, null, null, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.PARAM;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(defaultValue, pattern);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitParam(this);
    }
}
