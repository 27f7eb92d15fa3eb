package info.isaksson.erland.metatree.ir;

/**
 * Exhaustive visitor over the meta-tree grammar.
 */
public interface MetaNodeVisitor<R> {

    R visitLiteral(Literal node);

    R visitVariable(Variable node);

    R visitList(ListNode node);

    R visitMap(MapNode node);

    R visitPair(Pair node);

    R visitTuple(TupleNode node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);

    R visitFunctionCall(FunctionCall node);

    R visitConditional(Conditional node);

    R visitEarlyReturn(EarlyReturn node);

    R visitBlock(Block node);

    R visitAssignment(Assignment node);

    R visitInlineMatch(InlineMatch node);

    R visitLoop(Loop node);

    R visitLambda(Lambda node);

    R visitCollectionOp(CollectionOp node);

    R visitPatternMatch(PatternMatch node);

    R visitMatchArm(MatchArm node);

    R visitExceptionHandling(ExceptionHandling node);

    R visitAsyncOperation(AsyncOperation node);

    R visitContainer(Container node);

    R visitFunctionDef(FunctionDef node);

    R visitParam(Param node);

    R visitAttributeAccess(AttributeAccess node);

    R visitAugmentedAssignment(AugmentedAssignment node);

    R visitProperty(Property node);

    R visitNativeEscape(NativeEscape node);
}
