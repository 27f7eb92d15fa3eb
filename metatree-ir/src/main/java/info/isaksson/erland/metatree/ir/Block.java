package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Sequence of statements. */
public record Block(List<MetaNode> statements, NodeMeta meta) implements MetaNode {

    public Block {
        statements = NodeLists.freeze(statements);
        meta = NodeLists.meta(meta);
    }

    public static Block of(List<MetaNode> statements) {
        return new Block(statements, NodeMeta.EMPTY);
    }

    @Override public NodeTag tag() {
        return NodeTag.BLOCK;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.present(statements);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
