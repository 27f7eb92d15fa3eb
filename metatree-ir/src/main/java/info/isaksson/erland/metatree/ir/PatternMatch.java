package info.isaksson.erland.metatree.ir;

import java.util.List;

/** Case/match expression over a scrutinee. */
public record PatternMatch(MetaNode scrutinee, List<MatchArm> arms, NodeMeta meta) implements MetaNode {

    public PatternMatch {
        arms = NodeLists.freeze(arms);
        meta = NodeLists.meta(meta);
    }

    @Override public NodeTag tag() {
        return NodeTag.PATTERN_MATCH;
    }

    @Override public List<MetaNode> children() {
        return NodeLists.slotsThen(NodeLists.slots(scrutinee), arms);
    }

    @Override public <R> R accept(MetaNodeVisitor<R> visitor) {
        return visitor.visitPatternMatch(this);
    }
}
