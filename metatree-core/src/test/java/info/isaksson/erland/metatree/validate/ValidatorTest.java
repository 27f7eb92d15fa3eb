package info.isaksson.erland.metatree.validate;

import info.isaksson.erland.metatree.ir.Assignment;
import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Block;
import info.isaksson.erland.metatree.ir.Conditional;
import info.isaksson.erland.metatree.ir.Document;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NativeEscape;
import info.isaksson.erland.metatree.ir.NodeMeta;
import info.isaksson.erland.metatree.ir.OperatorCategory;
import info.isaksson.erland.metatree.ir.Tier;
import info.isaksson.erland.metatree.ir.Variable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private final Validator validator = new Validator();

    private static MetaNode xPlus5() {
        return BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"), Literal.integer(5));
    }

    private static Document withEscape() {
        MetaNode tree = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"),
                NativeEscape.of("mini", "native_block", "native{y}"));
        return Document.of(tree, "mini");
    }

    private static MetaNode nested(int levels) {
        MetaNode current = xPlus5();
        for (int i = 0; i < levels; i++) {
            current = new Conditional(Literal.bool(true), current, null, NodeMeta.EMPTY);
        }
        return current;
    }

    @Test
    void reportsShapeOfCoreTree() throws Exception {
        MetaNode tree = Block.of(List.of(
                Assignment.of(Variable.named("a"), Literal.integer(1)),
                Assignment.of(Variable.named("b"), BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("a"), Variable.named("a")))));
        ValidationReport r = validator.validate(Document.of(tree, "mini"));
        assertEquals(Tier.CORE, r.level());
        assertEquals(1, r.depth());
        assertEquals(9, r.nodeCount());
        assertEquals(List.of("a", "b"), List.copyOf(r.variables()));
        assertEquals(2, r.distinctVariableCount());
        assertEquals(0, r.nativeConstructCount());
        assertTrue(r.warnings().isEmpty());
    }

    @Test
    void strictModeRejectsEscapes() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(withEscape(), ValidationMode.STRICT, ValidationLimits.DEFAULTS));
        assertEquals(ValidationException.Reason.NATIVE_CONSTRUCT_IN_STRICT_MODE, e.reason());
        assertTrue(e.getMessage().startsWith("native_construct_in_strict_mode"));
    }

    @Test
    void standardModeWarnsExactlyOnce() throws Exception {
        ValidationReport r = validator.validate(withEscape(), ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
        assertEquals(1, r.warnings().size());
        assertEquals(ValidationWarning.Code.NATIVE_CONSTRUCTS_PRESENT, r.warnings().get(0).code());
        assertEquals(Tier.NATIVE, r.level());
        assertEquals(1, r.nativeConstructCount());
    }

    @Test
    void permissiveModeHasNoWarnings() throws Exception {
        ValidationReport r = validator.validate(withEscape(), ValidationMode.PERMISSIVE, ValidationLimits.DEFAULTS);
        assertTrue(r.warnings().isEmpty());
        assertEquals(1, r.nativeConstructCount());

        ValidationReport big = validator.validateTree(nested(150), ValidationMode.PERMISSIVE, ValidationLimits.DEFAULTS);
        assertTrue(big.warnings().isEmpty());
    }

    @Test
    void strictModeAcceptsEscapeFreeTrees() throws Exception {
        ValidationReport r = validator.validate(Document.of(xPlus5(), "mini"), ValidationMode.STRICT, ValidationLimits.DEFAULTS);
        assertEquals(Tier.CORE, r.level());
        assertTrue(r.warnings().isEmpty());
    }

    @Test
    void advisoryWarningsForDeepAndLargeTrees() throws Exception {
        ValidationReport deep = validator.validateTree(nested(150), ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
        assertEquals(151, deep.depth());
        assertTrue(deep.hasWarning(ValidationWarning.Code.DEEP_NESTING));

        List<MetaNode> many = new ArrayList<>();
        for (int i = 0; i < 1000; i++) many.add(Literal.integer(i));
        ValidationReport large = validator.validateTree(Block.of(many), ValidationMode.STRICT, ValidationLimits.DEFAULTS);
        assertEquals(1001, large.nodeCount());
        assertTrue(large.hasWarning(ValidationWarning.Code.LARGE_TREE));
        assertFalse(large.hasWarning(ValidationWarning.Code.DEEP_NESTING));
    }

    @Test
    void limitsHaveDistinctReasons() {
        ValidationException depth = assertThrows(ValidationException.class,
                () -> validator.validateTree(nested(5), ValidationMode.STANDARD, ValidationLimits.DEFAULTS.withMaxDepth(3)));
        assertEquals(ValidationException.Reason.MAX_DEPTH_EXCEEDED, depth.reason());

        ValidationException nodes = assertThrows(ValidationException.class,
                () -> validator.validateTree(xPlus5(), ValidationMode.STANDARD, ValidationLimits.DEFAULTS.withMaxNodeCount(2)));
        assertEquals(ValidationException.Reason.MAX_NODE_COUNT_EXCEEDED, nodes.reason());

        ValidationException vars = assertThrows(ValidationException.class,
                () -> validator.validateTree(xPlus5(), ValidationMode.STANDARD, ValidationLimits.DEFAULTS.withMaxVariables(0)));
        assertEquals(ValidationException.Reason.MAX_VARIABLES_EXCEEDED, vars.reason());
    }

    @Test
    void nonConformingTreeIsInvalidStructure() {
        MetaNode broken = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"), null);
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validateTree(broken, ValidationMode.PERMISSIVE, ValidationLimits.DEFAULTS));
        assertEquals(ValidationException.Reason.INVALID_STRUCTURE, e.reason());
        assertFalse(validator.isValid(withEscape(), ValidationMode.STRICT, ValidationLimits.DEFAULTS));
        assertTrue(validator.isValid(withEscape(), ValidationMode.STANDARD, ValidationLimits.DEFAULTS));
    }

    @Test
    void validationIsIdempotent() throws Exception {
        Document doc = withEscape();
        ValidationReport a = validator.validate(doc, ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
        ValidationReport b = validator.validate(doc, ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
        assertEquals(a, b);
        assertEquals(a.toJsonString(), b.toJsonString());
        assertTrue(a.toJsonString().contains("\"native_constructs_present\""));
    }

    @Test
    void limitsRejectNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationLimits(0, 10, 10));
        assertEquals(ValidationMode.PERMISSIVE, ValidationMode.fromWire("permissive"));
    }
}
