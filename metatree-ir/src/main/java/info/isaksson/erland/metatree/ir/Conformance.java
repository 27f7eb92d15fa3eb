package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Structural conformance of a meta-tree against the grammar.
 *
 * <p>A node conforms when every mandatory slot is present, its scalar attributes are well formed
 * for its tag (non-blank names and operators, literal values matching their subtype, loop and
 * collection-op arity matching their kind) and every child conforms as well. There is no partial
 * success.</p>
 */
public final class Conformance {

    private static final Checker CHECKER = new Checker();

    private Conformance() {}

    public static boolean conforms(MetaNode node) {
        return node != null && node.accept(CHECKER);
    }

    /**
     * The deepest tier used anywhere in the tree. A single {@link NativeEscape} makes the whole
     * tree {@link Tier#NATIVE}.
     */
    public static Tier level(MetaNode node) {
        if (node == null) throw new IllegalArgumentException("node is null");
        Tier level = node.tier();
        for (MetaNode child : node.children()) {
            if (level == Tier.NATIVE) break;
            level = Tier.deepest(level, level(child));
        }
        return level;
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }

    private static final class Checker implements MetaNodeVisitor<Boolean> {

        private boolean ok(MetaNode n) {
            return n != null && n.accept(this);
        }

        private boolean optional(MetaNode n) {
            return n == null || n.accept(this);
        }

        private boolean all(List<? extends MetaNode> nodes) {
            for (MetaNode n : nodes) {
                if (!ok(n)) return false;
            }
            return true;
        }

        @Override public Boolean visitLiteral(Literal n) {
            return n.valueMatchesSubtype();
        }

        @Override public Boolean visitVariable(Variable n) {
            return present(n.name());
        }

        @Override public Boolean visitList(ListNode n) {
            return all(n.elements());
        }

        @Override public Boolean visitMap(MapNode n) {
            return all(n.entries());
        }

        @Override public Boolean visitPair(Pair n) {
            return ok(n.key()) && ok(n.value());
        }

        @Override public Boolean visitTuple(TupleNode n) {
            return all(n.elements());
        }

        @Override public Boolean visitBinaryOp(BinaryOp n) {
            return n.category() != null && present(n.operator()) && ok(n.left()) && ok(n.right());
        }

        @Override public Boolean visitUnaryOp(UnaryOp n) {
            return n.category() != null && present(n.operator()) && ok(n.operand());
        }

        @Override public Boolean visitFunctionCall(FunctionCall n) {
            return present(n.name()) && all(n.args());
        }

        @Override public Boolean visitConditional(Conditional n) {
            return ok(n.condition()) && ok(n.thenBranch()) && optional(n.elseBranch());
        }

        @Override public Boolean visitEarlyReturn(EarlyReturn n) {
            return optional(n.value());
        }

        @Override public Boolean visitBlock(Block n) {
            return all(n.statements());
        }

        @Override public Boolean visitAssignment(Assignment n) {
            return (n.declaredType() == null || present(n.declaredType())) && ok(n.target()) && ok(n.value());
        }

        @Override public Boolean visitInlineMatch(InlineMatch n) {
            return ok(n.pattern()) && ok(n.value());
        }

        @Override public Boolean visitLoop(Loop n) {
            if (n.kind() == null) return false;
            if (n.kind() == LoopKind.WHILE) {
                return n.iterator() == null && ok(n.source()) && ok(n.body());
            }
            return ok(n.iterator()) && ok(n.source()) && ok(n.body());
        }

        @Override public Boolean visitLambda(Lambda n) {
            return all(n.params()) && all(n.body());
        }

        @Override public Boolean visitCollectionOp(CollectionOp n) {
            if (n.kind() == null) return false;
            if (n.kind() == CollectionOpKind.REDUCE) {
                return ok(n.function()) && ok(n.collection()) && ok(n.initial());
            }
            return n.initial() == null && ok(n.function()) && ok(n.collection());
        }

        @Override public Boolean visitPatternMatch(PatternMatch n) {
            return ok(n.scrutinee()) && all(n.arms());
        }

        @Override public Boolean visitMatchArm(MatchArm n) {
            return optional(n.pattern()) && optional(n.guard()) && all(n.body());
        }

        @Override public Boolean visitExceptionHandling(ExceptionHandling n) {
            return ok(n.body()) && all(n.handlers()) && optional(n.finallyBlock());
        }

        @Override public Boolean visitAsyncOperation(AsyncOperation n) {
            return n.kind() != null && ok(n.operation());
        }

        @Override public Boolean visitContainer(Container n) {
            return n.kind() != null && present(n.name()) && all(n.body());
        }

        @Override public Boolean visitFunctionDef(FunctionDef n) {
            return present(n.name())
                    && (n.returnType() == null || present(n.returnType()))
                    && all(n.params())
                    && all(n.body());
        }

        @Override public Boolean visitParam(Param n) {
            return present(n.name()) && optional(n.defaultValue()) && optional(n.pattern());
        }

        @Override public Boolean visitAttributeAccess(AttributeAccess n) {
            return present(n.attribute()) && ok(n.receiver());
        }

        @Override public Boolean visitAugmentedAssignment(AugmentedAssignment n) {
            return n.category() != null && present(n.operator()) && ok(n.target()) && ok(n.value());
        }

        @Override public Boolean visitProperty(Property n) {
            return present(n.name()) && optional(n.getter()) && optional(n.setter());
        }

        @Override public Boolean visitNativeEscape(NativeEscape n) {
            return present(n.language()) && present(n.hint()) && n.payload() != null;
        }
    }
}
