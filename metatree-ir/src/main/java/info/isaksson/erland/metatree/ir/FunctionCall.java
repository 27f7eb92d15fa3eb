package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Call of a named function. Qualified callees keep their dotted name (e.g. {@code Math.max}).
 */
public record FunctionCall(String name, List<MetaNode> args, NodeMeta meta) implements MetaNode {

    public FunctionCall {
        args = NodeLists.freeze(args);
        meta = NodeLists.meta(meta);
    }

    public static FunctionCall of(String name, List<MetaNode> args) {
        return new FunctionCall(name, args, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.FUNCTION_CALL;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(args);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
