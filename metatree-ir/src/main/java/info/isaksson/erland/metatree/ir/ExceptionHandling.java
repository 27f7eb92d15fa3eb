package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Try/catch/finally. Handlers are match arms whose pattern describes the caught exception. */
public record ExceptionHandling(MetaNode body, List<MatchArm> handlers, MetaNode finallyBlock, NodeMeta meta)
        implements MetaNode {

    public ExceptionHandling {
        handlers = NodeLists.freeze(handlers);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.EXCEPTION_HANDLING;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slotsThen(NodeLists.slots(body), handlers, finallyBlock);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitExceptionHandling(this);
    }
}
