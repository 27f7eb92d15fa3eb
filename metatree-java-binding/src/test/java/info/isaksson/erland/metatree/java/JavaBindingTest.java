package info.isaksson.erland.metatree.java;

import info.isaksson.erland.metatree.binding.Abstraction;
import info.isaksson.erland.metatree.binding.AbstractionException;
import info.isaksson.erland.metatree.binding.BindingContractChecker;
import info.isaksson.erland.metatree.binding.MiniExprBinding;
import info.isaksson.erland.metatree.binding.MutationRejectedException;
import info.isaksson.erland.metatree.binding.ParseException;
import info.isaksson.erland.metatree.binding.ReificationException;
import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Block;
import info.isaksson.erland.metatree.ir.Conformance;
import info.isaksson.erland.metatree.ir.Container;
import info.isaksson.erland.metatree.ir.ContainerKind;
import info.isaksson.erland.metatree.ir.EarlyReturn;
import info.isaksson.erland.metatree.ir.FunctionDef;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.Location;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.MetaNodeRewriter;
import info.isaksson.erland.metatree.ir.MetaNodes;
import info.isaksson.erland.metatree.ir.MetaTreeNormalizer;
import info.isaksson.erland.metatree.ir.NativeEscape;
import info.isaksson.erland.metatree.ir.NodeTag;
import info.isaksson.erland.metatree.ir.OperatorCategory;
import info.isaksson.erland.metatree.ir.Tier;
import info.isaksson.erland.metatree.ir.Variable;
import info.isaksson.erland.metatree.ir.Visibility;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JavaBindingTest {

    private static final String CART = String.join("\n",
            "package demo.shop;",
            "",
            "import java.util.List;",
            "",
            "public class Cart {",
            "",
            "    private final List<Integer> items = new java.util.ArrayList<>();",
            "",
            "    public int total(int discount) {",
            "        int sum = 0;",
            "        for (Integer item : items) {",
            "            sum += item;",
            "        }",
            "        if (sum > discount) {",
            "            return sum - discount;",
            "        }",
            "        return 0;",
            "    }",
            "",
            "    static String label(String name) {",
            "        try {",
            "            return name.trim();",
            "        } catch (NullPointerException e) {",
            "            return \"none\";",
            "        } finally {",
            "            log(\"label\");",
            "        }",
            "    }",
            "}",
            "");

    private final JavaBinding java = new JavaBinding();

    @Test
    void roundTripOfSimpleExpression() throws Exception {
        BindingContractChecker.RoundTrip rt = BindingContractChecker.roundTrip(java, "x + 5");
        MetaNode expected = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"), Literal.integer(5));
        assertEquals(expected, MetaTreeNormalizer.stripLocations(rt.first().tree()));
        assertEquals("x + 5", rt.regenerated());
        assertTrue(rt.semanticallyEqual());
        assertEquals("expression", rt.first().metadata().get(JavaNativeTree.METADATA_KEY));
    }

    @Test
    void locationsAreRecorded() throws Exception {
        BinaryOp sum = (BinaryOp) BindingContractChecker.abstractSource(java, "x + 5").tree();
        assertEquals(new Location(1, 1, 1, 5), sum.meta().location());
        assertEquals(new Location(1, 5, 1, 5), sum.right().meta().location());

        Block block = (Block) BindingContractChecker.abstractSource(java, "a = 1;\nb = 2;").tree();
        assertEquals(1, block.statements().get(0).meta().location().line());
        assertEquals(1, block.statements().get(0).meta().location().column());
        assertEquals(2, block.statements().get(1).meta().location().line());
    }

    @Test
    void parenthesesFollowPrecedence() throws Exception {
        assertEquals("(a + b) * c", BindingContractChecker.roundTrip(java, "((a + b)) * c").regenerated());
        assertEquals("a + b * c", BindingContractChecker.roundTrip(java, "a + (b * c)").regenerated());
        assertEquals("a - (b - c)", BindingContractChecker.roundTrip(java, "a - (b - c)").regenerated());
        assertEquals("!(a && b)", BindingContractChecker.roundTrip(java, "!(a && b)").regenerated());
    }

    @Test
    void localDeclarationsKeepTheirType() throws Exception {
        Block block = (Block) BindingContractChecker.abstractSource(java, "int total = 0;\ntotal += 2;").tree();
        Assignment decl = (Assignment) block.statements().get(0);
        assertEquals("int", decl.declaredType());
        assertEquals(NodeTag.AUGMENTED_ASSIGNMENT, block.statements().get(1).tag());
        assertEquals("int total = 0;\ntotal += 2;",
                BindingContractChecker.roundTrip(java, "int total = 0;\ntotal += 2;").regenerated());
    }

    @Test
    void statementEscapesReplayVerbatim() throws Exception {
        String source = "int y = 0;\nswitch (k) {  case 1: y = 2; break;  default: y = 3; }";
        BindingContractChecker.RoundTrip rt = BindingContractChecker.roundTrip(java, source);

        Block block = (Block) rt.first().tree();
        NativeEscape escape = (NativeEscape) block.statements().get(1);
        assertEquals("java", escape.language());
        assertEquals("switch_statement", escape.hint());
        assertEquals("switch (k) {  case 1: y = 2; break;  default: y = 3; }", escape.payload());
        assertEquals(Tier.NATIVE, Conformance.level(block));

        assertEquals(source, rt.regenerated());
        assertTrue(rt.semanticallyEqual());
    }

    @Test
    void classicForLoopIsEscaped() throws Exception {
        String source = "for (int i = 0; i < n; i++) {   total += i; }";
        NativeEscape escape = (NativeEscape) ((Block) BindingContractChecker.abstractSource(java, source).tree())
                .statements().get(0);
        assertEquals("for_statement", escape.hint());
        assertEquals(source, BindingContractChecker.roundTrip(java, source).regenerated());
    }

    @Test
    void expressionEscapesKeepTheirParentheses() throws Exception {
        assertEquals("(int) x + 1", BindingContractChecker.roundTrip(java, "(int) x + 1").regenerated());
        assertEquals("(a | b) * c", BindingContractChecker.roundTrip(java, "(a | b) * c").regenerated());

        BinaryOp product = (BinaryOp) BindingContractChecker.abstractSource(java, "(a | b) * c").tree();
        assertEquals("binary_expression", ((NativeEscape) product.left()).hint());
        assertEquals("a | b", ((NativeEscape) product.left()).payload());
    }

    @Test
    void compilationUnitMapsToContainers() throws Exception {
        Abstraction a = BindingContractChecker.assertConformsAfterAbstraction(java, CART);
        assertEquals("compilation_unit", a.metadata().get(JavaNativeTree.METADATA_KEY));

        Container pkg = (Container) a.tree();
        assertEquals(ContainerKind.NAMESPACE, pkg.kind());
        assertEquals("demo.shop", pkg.name());
        assertEquals("single_import", ((NativeEscape) pkg.body().get(0)).hint());

        Container cart = (Container) pkg.body().get(1);
        assertEquals(ContainerKind.CLASS, cart.kind());
        assertEquals(List.of("public"), cart.context().modifiers());
        assertEquals("demo.shop", cart.context().module());
        assertEquals("field_member", ((NativeEscape) cart.body().get(0)).hint());

        FunctionDef total = (FunctionDef) cart.body().get(1);
        assertEquals("total", total.name());
        assertEquals("int", total.returnType());
        assertEquals(Visibility.PUBLIC, total.visibility());
        assertEquals("Cart", total.context().module());
        assertEquals(1, total.context().arity());
        assertEquals("int", total.params().get(0).typeHint());

        FunctionDef label = (FunctionDef) cart.body().get(2);
        assertNull(label.visibility());
        assertEquals(List.of("static"), label.context().modifiers());
        assertEquals(NodeTag.EXCEPTION_HANDLING, label.body().get(0).tag());
    }

    @Test
    void compilationUnitRoundTripsSemantically() throws Exception {
        BindingContractChecker.RoundTrip rt = BindingContractChecker.roundTrip(java, CART);
        assertTrue(rt.semanticallyEqual(), rt.regenerated());
        assertTrue(rt.regenerated().contains("private final List<Integer> items = new java.util.ArrayList<>();"));
        assertTrue(rt.regenerated().contains("import java.util.List;"));
        assertTrue(rt.regenerated().contains("for (var item : items)"));
    }

    @Test
    void everyAbstractionConforms() throws Exception {
        List<String> sources = List.of(
                "x + 5",
                "f(x, 2) * (y - 1)",
                "System.out.println(\"hi\")",
                "items.stream().map(i -> i * 2)",
                "flag ? a.b : -c",
                "(x, y) -> { return x + y; }",
                "new StringBuilder().append('c')",
                "if (a > 1) b = 2; else if (a < 0) b = 3; else { b = 4; }",
                "while (n > 0) n -= 1;",
                "do { n++; } while (n < 10);",
                "throw new IllegalStateException(\"boom\");",
                "interface Shape { double area(); }\nenum Color { RED, GREEN }\nrecord Point(int x, int y) {}",
                CART);
        for (String source : sources) {
            MetaNode tree = BindingContractChecker.assertConformsAfterAbstraction(java, source).tree();
            assertTrue(Conformance.conforms(tree), source);
            assertTrue(BindingContractChecker.roundTrip(java, source).semanticallyEqual(), source);
        }
    }

    @Test
    void unrecognizedConstructIsNamed() {
        AbstractionException e = assertThrows(AbstractionException.class,
                () -> BindingContractChecker.abstractSource(java, "module demo.app { requires java.base; }"));
        assertEquals("ModuleDeclaration", e.construct());
    }

    @Test
    void parseErrorsCarryPosition() {
        ParseException e = assertThrows(ParseException.class, () -> java.parse("int x = ;"));
        assertEquals(1, e.line());
        assertThrows(ParseException.class, () -> java.parse("x +"));
        assertThrows(ParseException.class, () -> java.parse("public class {"));
    }

    @Test
    void dialectsOfDifferentLanguagesAbstractToEquivalentTrees() throws Exception {
        assertTrue(BindingContractChecker.abstractionsEquivalent(java, "x + 5", MiniExprBinding.capitalized(), "X + 5."));
        assertTrue(BindingContractChecker.abstractionsEquivalent(java, "a = 1; b = a + a;",
                MiniExprBinding.lower(), "a = 1; b = a + a"));
        assertFalse(BindingContractChecker.abstractionsEquivalent(java, "x + 5", MiniExprBinding.lower(), "x - 5"));
    }

    @Test
    void foreignEscapeIsNotReified() {
        MetaNode tree = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"),
                NativeEscape.of("mini", "native_block", "native{y}"));
        ReificationException e = assertThrows(ReificationException.class, () -> java.reify(tree, Map.of()));
        assertEquals("java", e.targetLanguage());
        assertEquals(NodeTag.LANGUAGE_SPECIFIC, e.tag());
    }

    @Test
    void escapeInTheWrongPositionIsNotReified() {
        MetaNode tree = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"),
                NativeEscape.of("java", "switch_statement", "switch (k) { default: }"));
        assertThrows(ReificationException.class, () -> java.reify(tree, Map.of()));
    }

    @Test
    void nodesWithoutJavaFormAreRejected() {
        MetaNode tree = new info.isaksson.erland.metatree.ir.ListNode(List.of(Literal.integer(1)),
                info.isaksson.erland.metatree.ir.NodeMeta.EMPTY);
        ReificationException e = assertThrows(ReificationException.class, () -> java.reify(tree, Map.of()));
        assertEquals(NodeTag.LIST, e.tag());
    }

    @Test
    void negativeLiteralsAndNestedSignsPrintUnambiguously() throws Exception {
        MetaNode minusMinus = new info.isaksson.erland.metatree.ir.UnaryOp(OperatorCategory.ARITHMETIC, "-",
                Literal.integer(-5), info.isaksson.erland.metatree.ir.NodeMeta.EMPTY);
        assertEquals("-(-5)", java.unparse(java.reify(minusMinus, Map.of())));
        MetaNode big = BinaryOp.of(OperatorCategory.ARITHMETIC, "*", Variable.named("x"), Literal.integer(3_000_000_000L));
        assertEquals("x * 3000000000L", java.unparse(java.reify(big, Map.of())));
    }

    @Test
    void mutationsAreCheckedAgainstJavaRules() throws Exception {
        Abstraction a = BindingContractChecker.abstractSource(java, CART);
        Container pkg = (Container) a.tree();
        Container withStrayReturn = new Container(pkg.kind(), pkg.name(),
                List.of(pkg.body().get(1), new EarlyReturn(null, info.isaksson.erland.metatree.ir.NodeMeta.EMPTY)),
                pkg.context(), pkg.meta());
        assertThrows(MutationRejectedException.class, () -> java.validateMutation(withStrayReturn, a.metadata()));

        MetaNode renamed = new MetaNodeRewriter() {
            @Override protected String variableName(String name) {
                return "sum".equals(name) ? "class" : name;
            }
        }.rewrite(pkg);
        MutationRejectedException e = assertThrows(MutationRejectedException.class,
                () -> java.validateMutation(renamed, a.metadata()));
        assertTrue(e.getMessage().contains("class"));

        java.validateMutation(pkg, a.metadata());
        assertEquals(2, MetaNodes.findAll(pkg, n -> n instanceof FunctionDef).size());
    }

    @Test
    void literalSuffixesSurviveRegeneration() throws Exception {
        for (String source : List.of("float f = 1.5f;", "var n = 5L;", "long big = a * 1000000L;",
                "double d = 2.5;", "long far = 3000000000L;", "long w = -2147483648L;")) {
            BindingContractChecker.RoundTrip rt = BindingContractChecker.assertRoundTrip(java, source);
            assertEquals(source, rt.regenerated());
            assertEquals(literalTypes(source), literalTypes(rt.regenerated()), source);
        }
        List<String> hints = MetaNodes.findAll(BindingContractChecker.abstractSource(java, "x = 1.5f + 5L;").tree(), n -> n instanceof NativeEscape)
                .stream().map(n -> ((NativeEscape) n).hint()).collect(Collectors.toList());
        assertEquals(List.of("double_literal_expression", "long_literal_expression"), hints);
    }

    @Test
    void smallestIntegersAreReadAsOneConstant() throws Exception {
        Abstraction intMin = BindingContractChecker.abstractSource(java, "int m = -2147483648;");
        assertEquals(1, MetaNodes.findAll(intMin.tree(), n -> n instanceof Literal l && Long.valueOf(Integer.MIN_VALUE).equals(l.value())).size());
        assertEquals("int m = -2147483648;", BindingContractChecker.assertRoundTrip(java, "int m = -2147483648;").regenerated());

        Abstraction longMin = BindingContractChecker.abstractSource(java, "long k = -9223372036854775808L;");
        assertEquals(1, MetaNodes.findAll(longMin.tree(), n -> n instanceof Literal l && Long.valueOf(Long.MIN_VALUE).equals(l.value())).size());
        BindingContractChecker.RoundTrip rt = BindingContractChecker.assertRoundTrip(java, "long k = -9223372036854775808L;");
        assertEquals("long k = -9223372036854775808L;", rt.regenerated());
        assertEquals(literalTypes("int m = -2147483648;"), literalTypes("int m = " + java.unparse(java.reify(Literal.integer(Integer.MIN_VALUE), Map.of())) + ";"));
    }

    @Test
    void escapeMarkersNeverClashWithSourceText() throws Exception {
        for (String source : List.of("String s = \"$mt$0$\";\ni++;", "String s = \"$mt$0$ $mt1$0$\";\ni++;")) {
            BindingContractChecker.RoundTrip rt = BindingContractChecker.assertRoundTrip(java, source);
            assertEquals(source, rt.regenerated());
        }
    }

    @Test
    void loneClassIsACompilationUnit() throws Exception {
        Abstraction a = BindingContractChecker.abstractSource(java, "class A { int f() { return 1; } }");
        assertEquals("compilation_unit", a.metadata().get("java.unit"));
        Container module = (Container) a.tree();
        assertEquals(ContainerKind.MODULE, module.kind());
        Container type = (Container) module.body().get(0);
        assertEquals(ContainerKind.CLASS, type.kind());
        assertEquals("A", type.name());
        assertEquals("f", ((FunctionDef) type.body().get(0)).name());
        BindingContractChecker.assertRoundTrip(java, "class A { int f() { return 1; } }");

        Abstraction commented = BindingContractChecker.abstractSource(java, "// helper\n/* doc */ final class B {}");
        assertEquals("compilation_unit", commented.metadata().get("java.unit"));
    }

    /** Literal node kinds in source order, with floats told apart from doubles. */
    private List<String> literalTypes(String source) throws Exception {
        return java.parse(source).node().findAll(LiteralExpr.class).stream()
                .map(l -> l instanceof DoubleLiteralExpr d && d.getValue().matches(".*[fF]")
                        ? "FloatLiteralExpr" : l.getClass().getSimpleName())
                .collect(Collectors.toList());
    }
}
