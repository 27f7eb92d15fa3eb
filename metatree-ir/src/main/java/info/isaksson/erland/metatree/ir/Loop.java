package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Loop. For {@link LoopKind#WHILE} the {@code iterator} is null and {@code source} is the condition;
 * for {@code FOR}/{@code FOR_EACH} {@code iterator} binds each element of the {@code source} collection.
 */
public record Loop(LoopKind kind, MetaNode iterator, MetaNode source, MetaNode body, NodeMeta meta)
        implements MetaNode {

    public Loop {
        meta = NodeLists.meta(meta);
    }

    public static Loop whileLoop(MetaNode condition, MetaNode body) {
        return new Loop(LoopKind.WHILE, null, condition, body, NodeMeta.EMPTY);
    }

    public static Loop forEach(MetaNode iterator, MetaNode collection, MetaNode body) {
        return new Loop(LoopKind.FOR_EACH, iterator, collection, body, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.LOOP;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slots(iterator, source, body);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
