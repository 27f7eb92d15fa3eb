package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * A meta-tree node: a tag, a metadata record and a payload (scalar value or ordered children).
 *
 * <p>The grammar is closed. Each tag has exactly one record implementing this interface, and
 * {@link MetaNodeVisitor} has one method per record, so adding a tag breaks every fold that does
 * not handle it yet.</p>
 */
public sealed interface MetaNode permits
        Literal, Variable, ListNode, MapNode, Pair, TupleNode, BinaryOp, UnaryOp, FunctionCall,
        Conditional, EarlyReturn, Block, Assignment, InlineMatch,
        Loop, Lambda, CollectionOp, PatternMatch, MatchArm, ExceptionHandling, AsyncOperation,
        Container, FunctionDef, Param, AttributeAccess, AugmentedAssignment, Property,
        NativeEscape {

    NodeTag tag();

    NodeMeta meta();

    /**
     * Child nodes in payload order. Leaf tags return an empty list; absent optional slots
     * (e.g. a missing else branch) are skipped.
     */
    List<MetaNode> children();

    <R> R accept(MetaNodeVisitor<R> visitor);

    default Tier tier() {
        return tag().tier();
    }
}
