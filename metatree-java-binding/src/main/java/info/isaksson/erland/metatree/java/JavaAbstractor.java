package info.isaksson.erland.metatree.java;

import com.github.javaparser.Position;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.UnionType;
import com.github.javaparser.ast.type.UnknownType;
import info.isaksson.erland.metatree.binding.Abstraction;
import info.isaksson.erland.metatree.binding.AbstractionException;
import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.AttributeAccess;
import info.isaksson.erland.metatree.ir.AugmentedAssignment;
import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Block;
import info.isaksson.erland.metatree.ir.BoundaryContext;
import info.isaksson.erland.metatree.ir.Conditional;
import info.isaksson.erland.metatree.ir.Container;
import info.isaksson.erland.metatree.ir.ContainerKind;
import info.isaksson.erland.metatree.ir.EarlyReturn;
import info.isaksson.erland.metatree.ir.ExceptionHandling;
import info.isaksson.erland.metatree.ir.FunctionCall;
import info.isaksson.erland.metatree.ir.FunctionDef;
import info.isaksson.erland.metatree.ir.Lambda;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.LiteralSubtype;
import info.isaksson.erland.metatree.ir.Location;
import info.isaksson.erland.metatree.ir.Loop;
import info.isaksson.erland.metatree.ir.LoopKind;
import info.isaksson.erland.metatree.ir.MatchArm;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NativeEscape;
import info.isaksson.erland.metatree.ir.NodeMeta;
import info.isaksson.erland.metatree.ir.OperatorCategory;
import info.isaksson.erland.metatree.ir.Param;
import info.isaksson.erland.metatree.ir.UnaryOp;
import info.isaksson.erland.metatree.ir.Variable;
import info.isaksson.erland.metatree.ir.Visibility;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JavaParser AST to meta-tree.
 *
 * <p>Constructs with a structural counterpart are mapped node by node. Everything else JavaParser
 * can produce inside expressions, statements and type bodies becomes a {@code language_specific}
 * node holding the construct's original source text; its hint names the construct and, through the
 * suffix, the position it may be replayed in (see {@link EscapeCategory}).</p>
 */
final class JavaAbstractor {

    /** Name used for the root container of a compilation unit without a package declaration. */
    static final String DEFAULT_MODULE = "default";

    private final boolean blockWrapped;

    private JavaAbstractor(boolean blockWrapped) {
        this.blockWrapped = blockWrapped;
    }

    static Abstraction abstractTree(JavaNativeTree tree) throws AbstractionException {
        JavaAbstractor a = new JavaAbstractor(tree.unit() == JavaNativeTree.Unit.STATEMENTS);
        Node node = tree.node();
        MetaNode root;
        switch (tree.unit()) {
            case EXPRESSION:
                root = a.expression(cast(node, Expression.class));
                break;
            case STATEMENTS:
                root = new Block(a.statements(cast(node, BlockStmt.class).getStatements()), NodeMeta.EMPTY);
                break;
            default:
                root = a.compilationUnit(cast(node, CompilationUnit.class));
                break;
        }
        return new Abstraction(root, Map.of(JavaNativeTree.METADATA_KEY, tree.unit().wireName()));
    }

    // ---------------------------------------------------------------------------------------------
    // Compilation units and type bodies
    // ---------------------------------------------------------------------------------------------

    private MetaNode compilationUnit(CompilationUnit cu) throws AbstractionException {
        if (cu.getModule().isPresent()) {
            throw new AbstractionException("ModuleDeclaration", "module descriptors have no meta-tree form");
        }
        Optional<PackageDeclaration> pkg = cu.getPackageDeclaration();
        String packageName = pkg.map(p -> p.getNameAsString()).orElse(null);
        if (pkg.isPresent() && !pkg.get().getAnnotations().isEmpty()) {
            throw new AbstractionException("PackageDeclaration", "annotated package declarations are not supported");
        }

        List<MetaNode> body = new ArrayList<>();
        for (ImportDeclaration imp : cu.getImports()) {
            String kind = imp.isStatic() ? "static" : imp.isAsterisk() ? "on_demand" : "single";
            body.add(new NativeEscape(JavaBinding.LANGUAGE, EscapeCategory.IMPORT.hint(kind), originalText(imp), meta(imp)));
        }
        for (TypeDeclaration<?> type : cu.getTypes()) {
            body.add(typeDeclaration(type, packageName, EscapeCategory.TYPE));
        }

        if (packageName == null) {
            return new Container(ContainerKind.MODULE, DEFAULT_MODULE, body, BoundaryContext.EMPTY, meta(cu));
        }
        return new Container(ContainerKind.NAMESPACE, packageName, body,
                BoundaryContext.ofModule(packageName, List.of()), meta(cu));
    }

    private MetaNode typeDeclaration(TypeDeclaration<?> type, String enclosing, EscapeCategory category)
            throws AbstractionException {
        if (type instanceof ClassOrInterfaceDeclaration c && isPlainClass(c)) {
            List<MetaNode> members = new ArrayList<>();
            for (BodyDeclaration<?> member : c.getMembers()) {
                members.add(member(member, c.getNameAsString()));
            }
            return new Container(ContainerKind.CLASS, c.getNameAsString(), members,
                    BoundaryContext.ofModule(enclosing, keywords(c.getModifiers())), meta(c));
        }
        return escape(type, category);
    }

    private MetaNode member(BodyDeclaration<?> member, String className) throws AbstractionException {
        if (member instanceof MethodDeclaration m && isPlainMethod(m)) {
            return method(m, className);
        }
        if (member instanceof TypeDeclaration<?> t) {
            return typeDeclaration(t, className, EscapeCategory.MEMBER);
        }
        return escape(member, EscapeCategory.MEMBER);
    }

    private MetaNode method(MethodDeclaration m, String className) throws AbstractionException {
        Visibility visibility = null;
        List<String> modifiers = new ArrayList<>();
        for (Modifier mod : m.getModifiers()) {
            switch (mod.getKeyword()) {
                case PUBLIC:
                    visibility = Visibility.PUBLIC;
                    break;
                case PROTECTED:
                    visibility = Visibility.PROTECTED;
                    break;
                case PRIVATE:
                    visibility = Visibility.PRIVATE;
                    break;
                default:
                    modifiers.add(mod.getKeyword().asString());
                    break;
            }
        }
        List<Param> params = new ArrayList<>();
        for (Parameter p : m.getParameters()) {
            params.add(new Param(p.getNameAsString(), p.getType().asString(), null, null, meta(p)));
        }
        BlockStmt body = m.getBody().orElseThrow();
        return new FunctionDef(m.getNameAsString(), params, statements(body.getStatements()), m.getType().asString(),
                visibility, BoundaryContext.ofFunction(className, m.getNameAsString(), params.size(), modifiers), meta(m));
    }

    private static boolean isPlainClass(ClassOrInterfaceDeclaration c) {
        return !c.isInterface()
                && c.getAnnotations().isEmpty()
                && c.getTypeParameters().isEmpty()
                && c.getExtendedTypes().isEmpty()
                && c.getImplementedTypes().isEmpty()
                && c.getPermittedTypes().isEmpty();
    }

    private static boolean isPlainMethod(MethodDeclaration m) {
        return m.getBody().isPresent()
                && m.getAnnotations().isEmpty()
                && m.getTypeParameters().isEmpty()
                && m.getThrownExceptions().isEmpty()
                && m.getReceiverParameter().isEmpty()
                && m.getParameters().stream().allMatch(JavaAbstractor::isPlainParameter);
    }

    private static boolean isPlainParameter(Parameter p) {
        return !p.isVarArgs() && p.getModifiers().isEmpty() && p.getAnnotations().isEmpty();
    }

    private static List<String> keywords(NodeList<Modifier> modifiers) {
        List<String> out = new ArrayList<>();
        for (Modifier m : modifiers) out.add(m.getKeyword().asString());
        return out;
    }

    // ---------------------------------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------------------------------

    private List<MetaNode> statements(NodeList<Statement> statements) throws AbstractionException {
        List<MetaNode> out = new ArrayList<>(statements.size());
        for (Statement s : statements) out.add(statement(s));
        return out;
    }

    private MetaNode statement(Statement s) throws AbstractionException {
        if (s instanceof ExpressionStmt es) {
            if (es.getExpression() instanceof VariableDeclarationExpr decl) {
                return declaration(es, decl);
            }
            return expression(es.getExpression());
        }
        if (s instanceof BlockStmt b) {
            return new Block(statements(b.getStatements()), meta(b));
        }
        if (s instanceof IfStmt i) {
            MetaNode elseBranch = i.getElseStmt().isPresent() ? statement(i.getElseStmt().get()) : null;
            return new Conditional(expression(i.getCondition()), statement(i.getThenStmt()), elseBranch, meta(i));
        }
        if (s instanceof WhileStmt w) {
            return new Loop(LoopKind.WHILE, null, expression(w.getCondition()), statement(w.getBody()), meta(w));
        }
        if (s instanceof ForEachStmt f) {
            VariableDeclarationExpr v = f.getVariable();
            if (!v.getModifiers().isEmpty() || !v.getAnnotations().isEmpty() || v.getVariables().size() != 1) {
                return escape(f, EscapeCategory.STATEMENT);
            }
            VariableDeclarator element = f.getVariableDeclarator();
            return new Loop(LoopKind.FOR_EACH, new Variable(element.getNameAsString(), meta(element.getName())),
                    expression(f.getIterable()), statement(f.getBody()), meta(f));
        }
        if (s instanceof ReturnStmt r) {
            MetaNode value = r.getExpression().isPresent() ? expression(r.getExpression().get()) : null;
            return new EarlyReturn(value, meta(r));
        }
        if (s instanceof TryStmt t) {
            return tryStatement(t);
        }
        return escape(s, EscapeCategory.STATEMENT);
    }

    private MetaNode declaration(ExpressionStmt stmt, VariableDeclarationExpr decl) throws AbstractionException {
        if (decl.getVariables().size() != 1 || !decl.getModifiers().isEmpty() || !decl.getAnnotations().isEmpty()) {
            return escape(stmt, EscapeCategory.STATEMENT);
        }
        VariableDeclarator v = decl.getVariable(0);
        if (v.getInitializer().isEmpty()) {
            return escape(stmt, EscapeCategory.STATEMENT);
        }
        return new Assignment(new Variable(v.getNameAsString(), meta(v.getName())),
                expression(v.getInitializer().get()), v.getType().asString(), meta(stmt));
    }

    private MetaNode tryStatement(TryStmt t) throws AbstractionException {
        if (!t.getResources().isEmpty()) {
            return escape(t, EscapeCategory.STATEMENT);
        }
        for (CatchClause c : t.getCatchClauses()) {
            Parameter p = c.getParameter();
            if (p.getType() instanceof UnionType || !isPlainParameter(p)) {
                return escape(t, EscapeCategory.STATEMENT);
            }
        }
        List<MatchArm> handlers = new ArrayList<>();
        for (CatchClause c : t.getCatchClauses()) {
            Parameter p = c.getParameter();
            Param pattern = new Param(p.getNameAsString(), p.getType().asString(), null, null, meta(p));
            handlers.add(new MatchArm(pattern, null, statements(c.getBody().getStatements()), meta(c)));
        }
        MetaNode finallyBlock = null;
        if (t.getFinallyBlock().isPresent()) {
            finallyBlock = statement(t.getFinallyBlock().get());
        }
        return new ExceptionHandling(statement(t.getTryBlock()), handlers, finallyBlock, meta(t));
    }

    // ---------------------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------------------

    private MetaNode expression(Expression e) throws AbstractionException {
        if (e instanceof EnclosedExpr enclosed) {
            return expression(enclosed.getInner());
        }
        if (e instanceof IntegerLiteralExpr i) {
            return new Literal(LiteralSubtype.INTEGER, i.asNumber(), meta(e));
        }
        if (e instanceof LongLiteralExpr l) {
            Number value = l.asNumber();
            // An int-sized long would come back as an int literal.
            if (value instanceof Long n && n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE) {
                return escape(e, EscapeCategory.EXPRESSION);
            }
            return new Literal(LiteralSubtype.INTEGER, value, meta(e));
        }
        if (e instanceof DoubleLiteralExpr d) {
            if (isFloat(d)) return escape(e, EscapeCategory.EXPRESSION);
            return new Literal(LiteralSubtype.FLOAT, d.asDouble(), meta(e));
        }
        if (e instanceof StringLiteralExpr s) {
            return new Literal(LiteralSubtype.STRING, s.asString(), meta(e));
        }
        if (e instanceof TextBlockLiteralExpr tb) {
            return new Literal(LiteralSubtype.STRING, tb.asString(), meta(e));
        }
        if (e instanceof BooleanLiteralExpr b) {
            return new Literal(LiteralSubtype.BOOLEAN, b.getValue(), meta(e));
        }
        if (e instanceof NullLiteralExpr) {
            return new Literal(LiteralSubtype.NULL, null, meta(e));
        }
        if (e instanceof NameExpr n) {
            return new Variable(n.getNameAsString(), meta(e));
        }
        if (e instanceof BinaryExpr b) {
            OperatorCategory category = JavaOperators.categoryOf(b.getOperator());
            if (category == null) return escape(e, EscapeCategory.EXPRESSION);
            return new BinaryOp(category, b.getOperator().asString(), expression(b.getLeft()), expression(b.getRight()),
                    meta(e));
        }
        if (e instanceof UnaryExpr u) {
            Optional<Long> boundary = negatedBoundary(u);
            if (boundary.isPresent()) {
                return new Literal(LiteralSubtype.INTEGER, boundary.get(), meta(e));
            }
            OperatorCategory category = JavaOperators.categoryOf(u.getOperator());
            if (category == null) return escape(e, EscapeCategory.EXPRESSION);
            return new UnaryOp(category, u.getOperator().asString(), expression(u.getExpression()), meta(e));
        }
        if (e instanceof MethodCallExpr call) {
            return methodCall(call);
        }
        if (e instanceof FieldAccessExpr f) {
            return new AttributeAccess(expression(f.getScope()), f.getNameAsString(), meta(e));
        }
        if (e instanceof ConditionalExpr c) {
            return new Conditional(expression(c.getCondition()), expression(c.getThenExpr()),
                    expression(c.getElseExpr()), meta(e));
        }
        if (e instanceof AssignExpr a) {
            return assignment(a);
        }
        if (e instanceof LambdaExpr l) {
            return lambda(l);
        }
        return escape(e, EscapeCategory.EXPRESSION);
    }

    private static boolean isFloat(DoubleLiteralExpr d) {
        String text = d.getValue();
        return text.endsWith("f") || text.endsWith("F");
    }

    /**
     * {@code -2147483648} and {@code -9223372036854775808L}: the magnitude alone is out of range, so
     * the sign and the literal are read as one constant.
     */
    private static Optional<Long> negatedBoundary(UnaryExpr u) {
        if (u.getOperator() != UnaryExpr.Operator.MINUS) return Optional.empty();
        Expression operand = u.getExpression();
        if (operand instanceof IntegerLiteralExpr i && i.asNumber() instanceof Long) {
            return Optional.of((long) Integer.MIN_VALUE);
        }
        if (operand instanceof LongLiteralExpr l && l.asNumber() instanceof BigInteger) {
            return Optional.of(Long.MIN_VALUE);
        }
        return Optional.empty();
    }

    private MetaNode methodCall(MethodCallExpr call) throws AbstractionException {
        if (call.getTypeArguments().isPresent()) {
            return escape(call, EscapeCategory.EXPRESSION);
        }
        String name = call.getNameAsString();
        if (call.getScope().isPresent()) {
            Optional<String> qualifier = dottedName(call.getScope().get());
            if (qualifier.isEmpty()) return escape(call, EscapeCategory.EXPRESSION);
            name = qualifier.get() + "." + name;
        }
        List<MetaNode> args = new ArrayList<>();
        for (Expression arg : call.getArguments()) args.add(expression(arg));
        return new FunctionCall(name, args, meta(call));
    }

    private static Optional<String> dottedName(Expression scope) {
        if (scope instanceof NameExpr n) return Optional.of(n.getNameAsString());
        if (scope instanceof FieldAccessExpr f && f.getTypeArguments().isEmpty()) {
            return dottedName(f.getScope()).map(q -> q + "." + f.getNameAsString());
        }
        return Optional.empty();
    }

    private MetaNode assignment(AssignExpr a) throws AbstractionException {
        if (a.getOperator() == AssignExpr.Operator.ASSIGN) {
            return new Assignment(expression(a.getTarget()), expression(a.getValue()), null, meta(a));
        }
        String binary = JavaOperators.arithmeticPartOf(a.getOperator());
        if (binary == null) return escape(a, EscapeCategory.EXPRESSION);
        return new AugmentedAssignment(OperatorCategory.ARITHMETIC, binary, expression(a.getTarget()),
                expression(a.getValue()), meta(a));
    }

    private MetaNode lambda(LambdaExpr l) throws AbstractionException {
        List<Param> params = new ArrayList<>();
        for (Parameter p : l.getParameters()) {
            if (!isPlainParameter(p)) return escape(l, EscapeCategory.EXPRESSION);
            String typeHint = p.getType() instanceof UnknownType ? null : p.getType().asString();
            params.add(new Param(p.getNameAsString(), typeHint, null, null, meta(p)));
        }
        List<MetaNode> body = new ArrayList<>();
        Optional<Expression> expressionBody = l.getExpressionBody();
        if (expressionBody.isPresent()) {
            body.add(expression(expressionBody.get()));
        } else {
            body.add(statement(l.getBody()));
        }
        return new Lambda(params, body, meta(l));
    }

    // ---------------------------------------------------------------------------------------------
    // Escapes and locations
    // ---------------------------------------------------------------------------------------------

    private NativeEscape escape(Node node, EscapeCategory category) {
        return new NativeEscape(JavaBinding.LANGUAGE, category.hintFor(node.getClass()), originalText(node), meta(node));
    }

    /** The node's source text exactly as written, comments and whitespace included. */
    static String originalText(Node node) {
        return node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
    }

    private NodeMeta meta(Node node) {
        return node.getRange()
                .map(r -> NodeMeta.of(new Location(r.begin.line, column(r.begin), r.end.line, column(r.end))))
                .orElse(NodeMeta.EMPTY);
    }

    private int column(Position p) {
        return blockWrapped && p.line == 1 ? Math.max(1, p.column - 1) : p.column;
    }

    private static <T extends Node> T cast(Node node, Class<T> type) throws AbstractionException {
        if (!type.isInstance(node)) {
            throw new AbstractionException(node.getClass().getSimpleName(),
                    "expected " + type.getSimpleName() + " at the root of the native tree");
        }
        return type.cast(node);
    }
}
