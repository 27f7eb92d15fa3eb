package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Anonymous function. */
public record Lambda(List<Param> params, List<MetaNode> body, NodeMeta meta) implements MetaNode {

    public Lambda {
        params = NodeLists.freeze(params);
        body = NodeLists.freeze(body);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.LAMBDA;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slotsThen(params, body);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
