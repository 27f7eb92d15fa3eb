package info.isaksson.erland.metatree.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. The base implementation is an identity copy; subclasses override the
 * narrow hooks ({@link #meta}, {@link #context}, {@link #variableName}, {@link #paramName}) or whole
 * {@code visit*} methods to transform.
 */
public class MetaNodeRewriter implements MetaNodeVisitor<MetaNode> {

    public MetaNode rewrite(MetaNode node) {
        return node == null ? null : node.accept(this);
    }

    protected NodeMeta meta(NodeMeta meta) {
        return meta;
    }

    protected BoundaryContext context(BoundaryContext context) {
        return context;
    }

    protected String variableName(String name) {
        return name;
    }

    protected String paramName(String name) {
        return name;
    }

    protected List<MetaNode> all(List<MetaNode> nodes) {
        List<MetaNode> out = new ArrayList<>(nodes.size());
        for (MetaNode n : nodes) out.add(rewrite(n));
        return out;
    }

    protected List<Param> params(List<Param> params) {
        List<Param> out = new ArrayList<>(params.size());
        for (Param p : params) out.add(p == null ? null : (Param) p.accept(this));
        return out;
    }

    protected List<MatchArm> arms(List<MatchArm> arms) {
        List<MatchArm> out = new ArrayList<>(arms.size());
        for (MatchArm a : arms) out.add(a == null ? null : (MatchArm) a.accept(this));
        return out;
    }

    @Override public MetaNode visitLiteral(Literal n) {
        return new Literal(n.subtype(), n.value(), meta(n.meta()));
    }

    @Override public MetaNode visitVariable(Variable n) {
        return new Variable(variableName(n.name()), meta(n.meta()));
    }

    @Override public MetaNode visitList(ListNode n) {
        return new ListNode(all(n.elements()), meta(n.meta()));
    }

    @Override public MetaNode visitMap(MapNode n) {
        List<Pair> entries = new ArrayList<>(n.entries().size());
        for (Pair p : n.entries()) entries.add(p == null ? null : (Pair) p.accept(this));
        return new MapNode(entries, meta(n.meta()));
    }

    @Override public MetaNode visitPair(Pair n) {
        return new Pair(rewrite(n.key()), rewrite(n.value()), meta(n.meta()));
    }

    @Override public MetaNode visitTuple(TupleNode n) {
        return new TupleNode(all(n.elements()), meta(n.meta()));
    }

    @Override public MetaNode visitBinaryOp(BinaryOp n) {
        return new BinaryOp(n.category(), n.operator(), rewrite(n.left()), rewrite(n.right()), meta(n.meta()));
    }

    @Override public MetaNode visitUnaryOp(UnaryOp n) {
        return new UnaryOp(n.category(), n.operator(), rewrite(n.operand()), meta(n.meta()));
    }

    @Override public MetaNode visitFunctionCall(FunctionCall n) {
        return new FunctionCall(n.name(), all(n.args()), meta(n.meta()));
    }

    @Override public MetaNode visitConditional(Conditional n) {
        return new Conditional(rewrite(n.condition()), rewrite(n.thenBranch()), rewrite(n.elseBranch()), meta(n.meta()));
    }

    @Override public MetaNode visitEarlyReturn(EarlyReturn n) {
        return new EarlyReturn(rewrite(n.value()), meta(n.meta()));
    }

    @Override public MetaNode visitBlock(Block n) {
        return new Block(all(n.statements()), meta(n.meta()));
    }

    @Override public MetaNode visitAssignment(Assignment n) {
        return new Assignment(rewrite(n.target()), rewrite(n.value()), n.declaredType(), meta(n.meta()));
    }

    @Override public MetaNode visitInlineMatch(InlineMatch n) {
        return new InlineMatch(rewrite(n.pattern()), rewrite(n.value()), meta(n.meta()));
    }

    @Override public MetaNode visitLoop(Loop n) {
        return new Loop(n.kind(), rewrite(n.iterator()), rewrite(n.source()), rewrite(n.body()), meta(n.meta()));
    }

    @Override public MetaNode visitLambda(Lambda n) {
        return new Lambda(params(n.params()), all(n.body()), meta(n.meta()));
    }

    @Override public MetaNode visitCollectionOp(CollectionOp n) {
        return new CollectionOp(n.kind(), rewrite(n.function()), rewrite(n.collection()), rewrite(n.initial()), meta(n.meta()));
    }

    @Override public MetaNode visitPatternMatch(PatternMatch n) {
        return new PatternMatch(rewrite(n.scrutinee()), arms(n.arms()), meta(n.meta()));
    }

    @Override public MetaNode visitMatchArm(MatchArm n) {
        return new MatchArm(rewrite(n.pattern()), rewrite(n.guard()), all(n.body()), meta(n.meta()));
    }

    @Override public MetaNode visitExceptionHandling(ExceptionHandling n) {
        return new ExceptionHandling(rewrite(n.body()), arms(n.handlers()), rewrite(n.finallyBlock()), meta(n.meta()));
    }

    @Override public MetaNode visitAsyncOperation(AsyncOperation n) {
        return new AsyncOperation(n.kind(), rewrite(n.operation()), meta(n.meta()));
    }

    @Override public MetaNode visitContainer(Container n) {
        return new Container(n.kind(), n.name(), all(n.body()), context(n.context()), meta(n.meta()));
    }

    @Override public MetaNode visitFunctionDef(FunctionDef n) {
        return new FunctionDef(n.name(), params(n.params()), all(n.body()), n.returnType(), n.visibility(),
                context(n.context()), meta(n.meta()));
    }

    @Override public MetaNode visitParam(Param n) {
        return new Param(paramName(n.name()), n.typeHint(), rewrite(n.defaultValue()), rewrite(n.pattern()), meta(n.meta()));
    }

    @Override public MetaNode visitAttributeAccess(AttributeAccess n) {
        return new AttributeAccess(rewrite(n.receiver()), n.attribute(), meta(n.meta()));
    }

    @Override public MetaNode visitAugmentedAssignment(AugmentedAssignment n) {
        return new AugmentedAssignment(n.category(), n.operator(), rewrite(n.target()), rewrite(n.value()), meta(n.meta()));
    }

    @Override public MetaNode visitProperty(Property n) {
        return new Property(n.name(), rewrite(n.getter()), rewrite(n.setter()), meta(n.meta()));
    }

    @Override public MetaNode visitNativeEscape(NativeEscape n) {
        return new NativeEscape(n.language(), n.hint(), n.payload(), meta(n.meta()));
    }
}
