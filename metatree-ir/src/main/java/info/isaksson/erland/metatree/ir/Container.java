package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Module, class or namespace. Carries its own {@link BoundaryContext}. */
public record Container(ContainerKind kind, String name, List<MetaNode> body, BoundaryContext context,
                        NodeMeta meta) implements MetaNode {

    public Container {
        body = NodeLists.freeze(body);
        context = context == null ? BoundaryContext.EMPTY : context;
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.CONTAINER;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(body);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitContainer(this);
    }
}
