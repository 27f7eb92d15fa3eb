package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Named function definition. {@code returnType} and {@code visibility} are optional; a null
 * visibility means the source language's default.
 */
public record FunctionDef(String name, List<Param> params, List<MetaNode> body, String returnType,
                          Visibility visibility, BoundaryContext context, NodeMeta meta) implements MetaNode {

    public FunctionDef {
        params = NodeLists.freeze(params);
        body = NodeLists.freeze(body);
        context = context == null ? BoundaryContext.EMPTY : context;
        meta = NodeLists.meta(meta);
    }

    public int arity() {
        return params.size();
    }

    @Override public NodeTag tag() {
        return NodeTag.FUNCTION_DEF;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slotsThen(params, body);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}
