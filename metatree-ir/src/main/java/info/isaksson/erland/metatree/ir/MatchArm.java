package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * One arm of a {@link PatternMatch} or one handler of an {@link ExceptionHandling}.
 * A null {@code pattern} matches anything; {@code guard} is optional.
 */
public record MatchArm(MetaNode pattern, MetaNode guard, List<MetaNode> body, NodeMeta meta) implements MetaNode {

    public MatchArm {
        body = NodeLists.freeze(body);
        meta = NodeLists.meta(meta);
    }

    public boolean isWildcard() {
        return pattern == null;
    }

    @Override public NodeTag tag() {
        return NodeTag.MATCH_ARM;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slotsThen(NodeLists.slots(pattern, guard), body);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitMatchArm(this);
    }
}
