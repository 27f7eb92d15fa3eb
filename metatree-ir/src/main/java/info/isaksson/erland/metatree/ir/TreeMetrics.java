package info.isaksson.erland.metatree.ir;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Size and shape figures of a conforming meta-tree, computed by one bottom-up fold.
 *
 * <ul>
 *   <li>{@code depth}: scope nesting. A flat expression has depth 1; a child that enters a new
 *       lexical or control scope (branch of a conditional, loop body, lambda/function body, try
 *       body, handler, finally, match arm) adds one. Siblings never add to each other.</li>
 *   <li>{@code nodeCount}: {@code 1 + sum(nodeCount(child))}.</li>
 *   <li>{@code variables}: distinct names of {@link Variable} nodes, sorted.</li>
 *   <li>{@code nativeCount}: number of {@link NativeEscape} nodes.</li>
 *   <li>{@code level}: deepest {@link Tier} present.</li>
 * </ul>
 */
public record TreeMetrics(int depth, int nodeCount, SortedSet<String> variables, int nativeCount, Tier level) {

    public TreeMetrics {
        TreeSet<String> copy = new TreeSet<>();
        if (variables != null) copy.addAll(variables);
        variables = Collections.unmodifiableSortedSet(copy);
    }

    public static TreeMetrics of(MetaNode root) {
        if (root == null) throw new IllegalArgumentException("root is null");
        Shape shape = root.accept(new ShapeFold());
        return new TreeMetrics(shape.depth, shape.nodeCount, MetaNodes.variables(root), shape.nativeCount, shape.level);
    }

    public static int depth(MetaNode root) {
        return of(root).depth();
    }

    public static int nodeCount(MetaNode root) {
        return of(root).nodeCount();
    }

    public int distinctVariableCount() {
        return variables.size();
    }

    /** Immutable per-subtree accumulator. */
    private static final class Shape {
        final int depth;
        final int nodeCount;
        final int nativeCount;
        final Tier level;

        Shape(int depth, int nodeCount, int nativeCount, Tier level) {
            this.depth = depth;
            this.nodeCount = nodeCount;
            this.nativeCount = nativeCount;
            this.level = level;
        }
    }

    private static final class ShapeFold implements MetaNodeVisitor<Shape> {

        /** Combine a node with its children; {@code scoped} children enter a new scope. */
        private Shape node(MetaNode self, List<? extends MetaNode> plain, List<? extends MetaNode> scoped) {
            int depth = 1;
            int count = 1;
            int natives = self.tag() == NodeTag.LANGUAGE_SPECIFIC ? 1 : 0;
            Tier level = self.tier();
            for (MetaNode c : plain) {
                if (c == null) continue;
                Shape s = c.accept(this);
                depth = Math.max(depth, s.depth);
                count += s.nodeCount;
                natives += s.nativeCount;
                level = Tier.deepest(level, s.level);
            }
            for (MetaNode c : scoped) {
                if (c == null) continue;
                Shape s = c.accept(this);
                depth = Math.max(depth, s.depth + 1);
                count += s.nodeCount;
                natives += s.nativeCount;
                level = Tier.deepest(level, s.level);
            }
            return new Shape(depth, count, natives, level);
        }

        private Shape flat(MetaNode self) {
            return node(self, self.children(), List.of());
        }

        @Override public Shape visitLiteral(Literal n) {
            return flat(n);
        }

        @Override public Shape visitVariable(Variable n) {
            return flat(n);
        }

        @Override public Shape visitList(ListNode n) {
            return flat(n);
        }

        @Override public Shape visitMap(MapNode n) {
            return flat(n);
        }

        @Override public Shape visitPair(Pair n) {
            return flat(n);
        }

        @Override public Shape visitTuple(TupleNode n) {
            return flat(n);
        }

        @Override public Shape visitBinaryOp(BinaryOp n) {
            return flat(n);
        }

        @Override public Shape visitUnaryOp(UnaryOp n) {
            return flat(n);
        }

        @Override public Shape visitFunctionCall(FunctionCall n) {
            return flat(n);
        }

        @Override public Shape visitConditional(Conditional n) {
            return node(n, NodeLists.slots(n.condition()), NodeLists.slots(n.thenBranch(), n.elseBranch()));
        }

        @Override public Shape visitEarlyReturn(EarlyReturn n) {
            return flat(n);
        }

        @Override public Shape visitBlock(Block n) {
            return flat(n);
        }

        @Override public Shape visitAssignment(Assignment n) {
            return flat(n);
        }

        @Override public Shape visitInlineMatch(InlineMatch n) {
            return flat(n);
        }

        @Override public Shape visitLoop(Loop n) {
            return node(n, NodeLists.slots(n.iterator(), n.source()), NodeLists.slots(n.body()));
        }

        @Override public Shape visitLambda(Lambda n) {
            return node(n, n.params(), n.body());
        }

        @Override public Shape visitCollectionOp(CollectionOp n) {
            return flat(n);
        }

        @Override public Shape visitPatternMatch(PatternMatch n) {
            return node(n, NodeLists.slots(n.scrutinee()), n.arms());
        }

        @Override public Shape visitMatchArm(MatchArm n) {
            return flat(n);
        }

        @Override public Shape visitExceptionHandling(ExceptionHandling n) {
            return node(n, List.of(), NodeLists.slotsThen(NodeLists.slots(n.body()), n.handlers(), n.finallyBlock()));
        }

        @Override public Shape visitAsyncOperation(AsyncOperation n) {
            return flat(n);
        }

        @Override public Shape visitContainer(Container n) {
            return flat(n);
        }

        @Override public Shape visitFunctionDef(FunctionDef n) {
            return node(n, n.params(), n.body());
        }

        @Override public Shape visitParam(Param n) {
            return flat(n);
        }

        @Override public Shape visitAttributeAccess(AttributeAccess n) {
            return flat(n);
        }

        @Override public Shape visitAugmentedAssignment(AugmentedAssignment n) {
            return flat(n);
        }

        @Override public Shape visitProperty(Property n) {
            return node(n, List.of(), NodeLists.slots(n.getter(), n.setter()));
        }

        @Override public Shape visitNativeEscape(NativeEscape n) {
            return flat(n);
        }
    }
}
