package info.isaksson.erland.metatree.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
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
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.ast.type.VarType;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.utils.StringEscapeUtils;
import info.isaksson.erland.metatree.binding.ReificationException;
import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.AttributeAccess;
import info.isaksson.erland.metatree.ir.AugmentedAssignment;
import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Block;
import info.isaksson.erland.metatree.ir.Conditional;
import info.isaksson.erland.metatree.ir.Container;
import info.isaksson.erland.metatree.ir.ContainerKind;
import info.isaksson.erland.metatree.ir.EarlyReturn;
import info.isaksson.erland.metatree.ir.ExceptionHandling;
import info.isaksson.erland.metatree.ir.FunctionCall;
import info.isaksson.erland.metatree.ir.FunctionDef;
import info.isaksson.erland.metatree.ir.Lambda;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.Loop;
import info.isaksson.erland.metatree.ir.MatchArm;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NativeEscape;
import info.isaksson.erland.metatree.ir.NodeTag;
import info.isaksson.erland.metatree.ir.Param;
import info.isaksson.erland.metatree.ir.UnaryOp;
import info.isaksson.erland.metatree.ir.Variable;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Meta-tree to JavaParser AST. One instance per call: it collects the escaped fragments it meets.
 *
 * <p>Each {@code language_specific} node is re-parsed to check it fits its position, then replaced by
 * a marker identifier ({@code $mt$N$}, with a prefix chosen to be absent from the tree) that {@link JavaBinding#unparse} swaps for the original
 * text. Parentheses are inserted wherever operator precedence requires them.</p>
 */
final class JavaReifier {

    private static final String MARKER_PREFIX = "$mt";

    private final JavaParser parser;
    private String markerPrefix = MARKER_PREFIX + "$";
    private final Map<String, JavaNativeTree.EscapedFragment> escapes = new LinkedHashMap<>();
    private final Map<String, Integer> escapedPrecedence = new HashMap<>();

    JavaReifier(JavaParser parser) {
        this.parser = parser;
    }

    JavaNativeTree reify(MetaNode tree, Map<String, String> metadata) throws ReificationException {
        JavaNativeTree.Unit unit = unitFor(tree, metadata);
        markerPrefix = markerPrefixFor(tree);
        Node node;
        switch (unit) {
            case EXPRESSION:
                node = expression(tree, JavaOperators.ASSIGNMENT);
                break;
            case STATEMENTS:
                node = tree instanceof Block b ? block(b.statements()) : block(List.of(tree));
                break;
            default:
                node = compilationUnit(tree);
                break;
        }
        return new JavaNativeTree(unit, node, escapes);
    }

    /** Unit recorded by abstraction, or a best guess from the root for trees from other languages. */
    static JavaNativeTree.Unit unitFor(MetaNode tree, Map<String, String> metadata) throws ReificationException {
        String recorded = metadata == null ? null : metadata.get(JavaNativeTree.METADATA_KEY);
        if (recorded != null) {
            try {
                return JavaNativeTree.Unit.fromWire(recorded);
            } catch (IllegalArgumentException e) {
                throw new ReificationException(tree.tag(), JavaBinding.LANGUAGE, e.getMessage());
            }
        }
        if (tree instanceof Container) return JavaNativeTree.Unit.COMPILATION_UNIT;
        if (tree instanceof NativeEscape e) {
            Optional<EscapeCategory> category = EscapeCategory.ofHint(e.hint());
            if (category.isPresent() && category.get() != EscapeCategory.EXPRESSION) {
                return category.get() == EscapeCategory.STATEMENT
                        ? JavaNativeTree.Unit.STATEMENTS : JavaNativeTree.Unit.COMPILATION_UNIT;
            }
            return JavaNativeTree.Unit.EXPRESSION;
        }
        if (tree instanceof Block || tree instanceof EarlyReturn || tree instanceof Loop
                || tree instanceof ExceptionHandling
                || tree instanceof Assignment a && a.declaredType() != null) {
            return JavaNativeTree.Unit.STATEMENTS;
        }
        return JavaNativeTree.Unit.EXPRESSION;
    }

    // ---------------------------------------------------------------------------------------------
    // Compilation units and type bodies
    // ---------------------------------------------------------------------------------------------

    private CompilationUnit compilationUnit(MetaNode tree) throws ReificationException {
        if (!(tree instanceof Container root)) {
            throw error(tree, "a compilation unit needs a container at the root");
        }
        CompilationUnit cu = new CompilationUnit();
        if (root.kind() == ContainerKind.CLASS) {
            cu.getTypes().add(classDeclaration(root));
            return cu;
        }
        if (root.kind() == ContainerKind.NAMESPACE) {
            cu.setPackageDeclaration(root.name());
        }
        for (MetaNode child : root.body()) {
            if (child instanceof Container c) {
                cu.getTypes().add(classDeclaration(c));
            } else if (child instanceof NativeEscape e && category(e) == EscapeCategory.IMPORT) {
                check(e, parser.parseImport(e.payload()));
                cu.getImports().add(new ImportDeclaration(marker(e, EscapeCategory.IMPORT), false, false));
            } else if (child instanceof NativeEscape e && category(e) == EscapeCategory.TYPE) {
                ParseResult<CompilationUnit> parsed = parser.parse(e.payload());
                check(e, parsed);
                if (parsed.getResult().get().getTypes().size() != 1) {
                    throw error(e, "payload must hold exactly one type declaration");
                }
                cu.getTypes().add(new ClassOrInterfaceDeclaration(new NodeList<>(), false,
                        marker(e, EscapeCategory.TYPE)));
            } else {
                throw error(child, "not allowed at the top level of a compilation unit");
            }
        }
        return cu;
    }

    private ClassOrInterfaceDeclaration classDeclaration(Container c) throws ReificationException {
        if (c.kind() != ContainerKind.CLASS) {
            throw error(c, c.kind().wireName() + " containers cannot be nested in Java");
        }
        ClassOrInterfaceDeclaration decl = new ClassOrInterfaceDeclaration(modifiers(c, c.context().modifiers()),
                false, c.name());
        for (MetaNode member : c.body()) {
            if (member instanceof FunctionDef f) {
                decl.getMembers().add(method(f));
            } else if (member instanceof Container nested) {
                decl.getMembers().add(classDeclaration(nested));
            } else if (member instanceof NativeEscape e && category(e) == EscapeCategory.MEMBER) {
                check(e, parser.parseBodyDeclaration(e.payload()));
                String marker = marker(e, EscapeCategory.MEMBER);
                decl.getMembers().add(new FieldDeclaration(new NodeList<>(),
                        new VariableDeclarator(new ClassOrInterfaceType(null, marker), marker)));
            } else {
                throw error(member, "not allowed in a class body");
            }
        }
        return decl;
    }

    private MethodDeclaration method(FunctionDef f) throws ReificationException {
        if (f.returnType() == null) {
            throw error(f, "Java methods need a return type");
        }
        NodeList<Modifier> modifiers = new NodeList<>();
        if (f.visibility() != null) {
            modifiers.add(new Modifier(keyword(f, f.visibility().wireName())));
        }
        modifiers.addAll(modifiers(f, f.context().modifiers()));

        NodeList<Parameter> params = new NodeList<>();
        for (Param p : f.params()) {
            if (p.typeHint() == null || p.defaultValue() != null || p.pattern() != null) {
                throw error(p, "Java method parameters need a type and take no default or pattern");
            }
            params.add(new Parameter(type(p, p.typeHint()), p.name()));
        }
        MethodDeclaration m = new MethodDeclaration(modifiers, type(f, f.returnType()), f.name());
        m.setParameters(params);
        m.setBody(block(f.body()));
        return m;
    }

    private NodeList<Modifier> modifiers(MetaNode owner, List<String> names) throws ReificationException {
        NodeList<Modifier> out = new NodeList<>();
        for (String name : names) out.add(new Modifier(keyword(owner, name)));
        return out;
    }

    private Modifier.Keyword keyword(MetaNode owner, String name) throws ReificationException {
        for (Modifier.Keyword k : Modifier.Keyword.values()) {
            if (k.asString().equals(name)) return k;
        }
        throw error(owner, "unknown modifier " + name);
    }

    private Type type(MetaNode owner, String text) throws ReificationException {
        if ("void".equals(text)) return new VoidType();
        ParseResult<Type> parsed = parser.parseType(text);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw error(owner, "not a Java type: " + text);
        }
        return parsed.getResult().get();
    }

    // ---------------------------------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------------------------------

    private BlockStmt block(List<MetaNode> statements) throws ReificationException {
        NodeList<Statement> out = new NodeList<>();
        for (MetaNode s : statements) out.add(statement(s));
        return new BlockStmt(out);
    }

    private Statement statement(MetaNode node) throws ReificationException {
        if (node instanceof Block b) {
            return block(b.statements());
        }
        if (node instanceof Conditional c) {
            Statement then = statement(c.thenBranch());
            Statement otherwise = c.elseBranch() == null ? null : statement(c.elseBranch());
            if (otherwise != null && then instanceof IfStmt inner && inner.getElseStmt().isEmpty()) {
                // keep the else attached to this if
                then = new BlockStmt(new NodeList<>(then));
            }
            return new IfStmt(expression(c.condition(), JavaOperators.ASSIGNMENT), then, otherwise);
        }
        if (node instanceof Loop l) {
            return loop(l);
        }
        if (node instanceof EarlyReturn r) {
            return r.value() == null ? new ReturnStmt() : new ReturnStmt(expression(r.value(), JavaOperators.ASSIGNMENT));
        }
        if (node instanceof ExceptionHandling h) {
            return tryStatement(h);
        }
        if (node instanceof Assignment a && a.declaredType() != null) {
            if (!(a.target() instanceof Variable v)) {
                throw error(a, "a local declaration needs a plain name as target");
            }
            VariableDeclarator declarator = new VariableDeclarator(type(a, a.declaredType()), v.name(),
                    expression(a.value(), JavaOperators.ASSIGNMENT));
            return new ExpressionStmt(new VariableDeclarationExpr(declarator));
        }
        if (node instanceof NativeEscape e && category(e) == EscapeCategory.STATEMENT) {
            check(e, parser.parseBlock("{" + e.payload() + "\n}"));
            return new ExpressionStmt(new NameExpr(marker(e, EscapeCategory.STATEMENT)));
        }
        if (node instanceof Container || node instanceof FunctionDef || node instanceof MatchArm
                || node instanceof Param) {
            throw error(node, "no Java statement form");
        }
        return new ExpressionStmt(expression(node, JavaOperators.ASSIGNMENT));
    }

    private Statement loop(Loop l) throws ReificationException {
        switch (l.kind()) {
            case WHILE:
                return new WhileStmt(expression(l.source(), JavaOperators.ASSIGNMENT), statement(l.body()));
            case FOR_EACH:
                if (!(l.iterator() instanceof Variable element)) {
                    throw error(l, "the element of an enhanced for must be a plain name");
                }
                return new ForEachStmt(new VariableDeclarationExpr(new VarType(), element.name()),
                        expression(l.source(), JavaOperators.ASSIGNMENT), statement(l.body()));
            default:
                throw error(l, l.kind().wireName() + " loops have no Java form");
        }
    }

    private Statement tryStatement(ExceptionHandling h) throws ReificationException {
        if (!(statement(h.body()) instanceof BlockStmt body)) {
            throw error(h, "the protected body must be a block");
        }
        NodeList<CatchClause> catches = new NodeList<>();
        for (MatchArm arm : h.handlers()) {
            if (!(arm.pattern() instanceof Param p) || p.typeHint() == null || arm.guard() != null) {
                throw error(arm, "Java handlers bind one typed parameter and take no guard");
            }
            catches.add(new CatchClause(new Parameter(type(p, p.typeHint()), p.name()), block(arm.body())));
        }
        BlockStmt finallyBlock = null;
        if (h.finallyBlock() != null) {
            if (!(statement(h.finallyBlock()) instanceof BlockStmt f)) {
                throw error(h, "the finally clause must be a block");
            }
            finallyBlock = f;
        }
        if (catches.isEmpty() && finallyBlock == null) {
            throw error(h, "a try needs at least one handler or a finally clause");
        }
        return new TryStmt(body, catches, finallyBlock);
    }

    // ---------------------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------------------

    private Expression expression(MetaNode node, int minPrecedence) throws ReificationException {
        Expression e = bareExpression(node);
        return precedence(e) < minPrecedence ? new EnclosedExpr(e) : e;
    }

    private int precedence(Expression e) {
        if (e instanceof NameExpr n && escapedPrecedence.containsKey(n.getNameAsString())) {
            return escapedPrecedence.get(n.getNameAsString());
        }
        return JavaOperators.precedence(e);
    }

    private Expression bareExpression(MetaNode node) throws ReificationException {
        if (node instanceof Literal l) {
            return literal(l);
        }
        if (node instanceof Variable v) {
            return new NameExpr(v.name());
        }
        if (node instanceof BinaryOp b) {
            BinaryExpr.Operator op = JavaOperators.binary(b.operator())
                    .orElseThrow(() -> error(b, "no Java operator " + b.operator()));
            int p = JavaOperators.precedence(op);
            return new BinaryExpr(expression(b.left(), p), expression(b.right(), p + 1), op);
        }
        if (node instanceof UnaryOp u) {
            UnaryExpr.Operator op = JavaOperators.prefix(u.operator())
                    .orElseThrow(() -> error(u, "no Java prefix operator " + u.operator()));
            Expression operand = expression(u.operand(), JavaOperators.PREFIX);
            if (startsWithSign(operand)) {
                operand = new EnclosedExpr(operand);
            }
            return new UnaryExpr(operand, op);
        }
        if (node instanceof FunctionCall call) {
            NodeList<Expression> args = new NodeList<>();
            for (MetaNode arg : call.args()) args.add(expression(arg, JavaOperators.ASSIGNMENT));
            int dot = call.name().lastIndexOf('.');
            if (dot < 0) {
                return new MethodCallExpr((Expression) null, call.name(), args);
            }
            return new MethodCallExpr(qualifier(call.name().substring(0, dot)), call.name().substring(dot + 1), args);
        }
        if (node instanceof AttributeAccess a) {
            return new FieldAccessExpr(expression(a.receiver(), JavaOperators.PRIMARY), a.attribute());
        }
        if (node instanceof Conditional c) {
            if (c.elseBranch() == null) {
                throw error(c, "a conditional expression needs an else branch");
            }
            return new ConditionalExpr(expression(c.condition(), JavaOperators.LOGICAL_OR),
                    expression(c.thenBranch(), JavaOperators.TERNARY),
                    expression(c.elseBranch(), JavaOperators.TERNARY));
        }
        if (node instanceof Assignment a) {
            if (a.declaredType() != null) {
                throw error(a, "a declaration cannot appear inside an expression");
            }
            return new AssignExpr(expression(a.target(), JavaOperators.PRIMARY),
                    expression(a.value(), JavaOperators.ASSIGNMENT), AssignExpr.Operator.ASSIGN);
        }
        if (node instanceof AugmentedAssignment a) {
            AssignExpr.Operator op = JavaOperators.compound(a.operator())
                    .orElseThrow(() -> error(a, "no Java compound operator " + a.operator() + "="));
            return new AssignExpr(expression(a.target(), JavaOperators.PRIMARY),
                    expression(a.value(), JavaOperators.ASSIGNMENT), op);
        }
        if (node instanceof Lambda l) {
            return lambda(l);
        }
        if (node instanceof NativeEscape e) {
            if (category(e) != EscapeCategory.EXPRESSION) {
                throw error(e, e.hint() + " cannot appear inside an expression");
            }
            ParseResult<Expression> parsed = parser.parseExpression(e.payload());
            check(e, parsed);
            String marker = marker(e, EscapeCategory.EXPRESSION);
            escapedPrecedence.put(marker, JavaOperators.precedence(parsed.getResult().get()));
            return new NameExpr(marker);
        }
        throw error(node, "no Java expression form");
    }

    private Expression literal(Literal l) throws ReificationException {
        Object value = l.value();
        switch (l.subtype()) {
            case INTEGER:
                if (!(value instanceof Long n)) {
                    throw error(l, "integer does not fit in a Java long: " + value);
                }
                if (n < 0) {
                    Expression magnitude;
                    if (n == Long.MIN_VALUE) {
                        magnitude = new LongLiteralExpr("9223372036854775808L");
                    } else if (n == Integer.MIN_VALUE) {
                        magnitude = new IntegerLiteralExpr("2147483648");
                    } else {
                        magnitude = integerLiteral(-n);
                    }
                    return new UnaryExpr(magnitude, UnaryExpr.Operator.MINUS);
                }
                return integerLiteral(n);
            case FLOAT:
                double d = value instanceof BigDecimal big ? big.doubleValue() : (Double) value;
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw error(l, "no Java literal for " + d);
                }
                if (Double.doubleToRawLongBits(d) < 0) {
                    return new UnaryExpr(new DoubleLiteralExpr(Double.toString(-d)), UnaryExpr.Operator.MINUS);
                }
                return new DoubleLiteralExpr(Double.toString(d));
            case STRING:
                return new StringLiteralExpr(StringEscapeUtils.escapeJava((String) value));
            case BOOLEAN:
                return new BooleanLiteralExpr((Boolean) value);
            case NULL:
                return new NullLiteralExpr();
            default:
                throw error(l, l.subtype().wireName() + " literals have no Java form");
        }
    }

    private static Expression integerLiteral(long n) {
        return n <= Integer.MAX_VALUE ? new IntegerLiteralExpr(String.valueOf(n)) : new LongLiteralExpr(n + "L");
    }

    private static Expression qualifier(String dotted) {
        String[] parts = dotted.split("\\.");
        Expression scope = new NameExpr(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            scope = new FieldAccessExpr(scope, parts[i]);
        }
        return scope;
    }

    private boolean startsWithSign(Expression operand) {
        if (operand instanceof UnaryExpr u) {
            return u.getOperator().isPrefix();
        }
        if (operand instanceof NameExpr n && escapes.containsKey(n.getNameAsString())) {
            String text = escapes.get(n.getNameAsString()).text().strip();
            return text.startsWith("+") || text.startsWith("-");
        }
        return false;
    }

    private Expression lambda(Lambda l) throws ReificationException {
        NodeList<Parameter> params = new NodeList<>();
        long typed = l.params().stream().filter(p -> p.typeHint() != null).count();
        if (typed != 0 && typed != l.params().size()) {
            throw error(l, "Java lambdas type all parameters or none");
        }
        for (Param p : l.params()) {
            if (p.defaultValue() != null || p.pattern() != null) {
                throw error(p, "Java lambda parameters take no default or pattern");
            }
            Type t = p.typeHint() == null ? new UnknownType() : type(p, p.typeHint());
            params.add(new Parameter(t, p.name()));
        }
        Statement body;
        List<MetaNode> nodes = l.body();
        if (nodes.size() == 1 && nodes.get(0) instanceof Block b) {
            body = block(b.statements());
        } else if (nodes.size() == 1 && isExpressionBody(nodes.get(0))) {
            body = new ExpressionStmt(expression(nodes.get(0), JavaOperators.ASSIGNMENT));
        } else {
            body = block(nodes);
        }
        return new LambdaExpr(params, body, params.size() != 1 || typed > 0);
    }

    private static boolean isExpressionBody(MetaNode node) {
        if (node instanceof Assignment a) return a.declaredType() == null;
        if (node instanceof NativeEscape e) return EscapeCategory.ofHint(e.hint()).orElse(null) == EscapeCategory.EXPRESSION;
        return !(node instanceof EarlyReturn || node instanceof Loop || node instanceof ExceptionHandling);
    }

    // ---------------------------------------------------------------------------------------------
    // Escapes
    // ---------------------------------------------------------------------------------------------

    private EscapeCategory category(NativeEscape e) throws ReificationException {
        if (!JavaBinding.LANGUAGE.equals(e.language())) {
            throw error(e, "escape from " + e.language() + " cannot be replayed as Java");
        }
        return EscapeCategory.ofHint(e.hint())
                .orElseThrow(() -> error(e, "escape hint " + e.hint() + " names no Java position"));
    }

    /**
     * A marker prefix that occurs in no name, literal or payload of the tree, so the printed output
     * contains it only where an escape was placed.
     */
    static String markerPrefixFor(MetaNode tree) {
        String text = tree.toString();
        String prefix = MARKER_PREFIX + "$";
        for (int n = 1; text.contains(prefix); n++) {
            prefix = MARKER_PREFIX + n + "$";
        }
        return prefix;
    }

    private String marker(NativeEscape e, EscapeCategory category) {
        String marker = markerPrefix + escapes.size() + "$";
        escapes.put(marker, new JavaNativeTree.EscapedFragment(category, e.payload()));
        return marker;
    }

    private void check(NativeEscape e, ParseResult<?> parsed) throws ReificationException {
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw error(e, "payload of " + e.hint() + " is not valid Java");
        }
    }

    private static ReificationException error(MetaNode node, String message) {
        NodeTag tag = node == null ? null : node.tag();
        return new ReificationException(tag, JavaBinding.LANGUAGE, message);
    }
}
