package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.BinaryOp;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.OperatorCategory;
import info.isaksson.erland.metatree.ir.Tier;
import info.isaksson.erland.metatree.ir.Conformance;
import info.isaksson.erland.metatree.ir.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BindingContractCheckerTest {

    private final MiniExprBinding lower = MiniExprBinding.lower();
    private final MiniExprBinding capitalized = MiniExprBinding.capitalized();

    @Test
    void roundTripOfSimpleExpression() throws Exception {
        BindingContractChecker.RoundTrip rt = BindingContractChecker.roundTrip(lower, "x + 5");
        MetaNode expected = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"), Literal.integer(5));
        assertEquals(expected, rt.first().tree());
        assertEquals("x + 5", rt.regenerated());
        assertTrue(rt.semanticallyEqual());
    }

    @Test
    void parenthesesFollowPrecedence() throws Exception {
        assertEquals("(a + b) * c", BindingContractChecker.roundTrip(lower, "((a + b)) * c").regenerated());
        assertEquals("a + b * c", BindingContractChecker.roundTrip(lower, "a + (b * c)").regenerated());
        assertEquals("a - (b - c)", BindingContractChecker.roundTrip(lower, "a - (b - c)").regenerated());
    }

    @Test
    void everyAbstractionConforms() throws Exception {
        for (String source : List.of("x + 5", "a = 1; b = a + a", "f(x, 2) * (y - 1)", "native{ raw { nested } } + 1", "g()")) {
            MetaNode tree = BindingContractChecker.assertConformsAfterAbstraction(lower, source).tree();
            assertTrue(Conformance.conforms(tree), source);
        }
    }

    @Test
    void escapesReplayVerbatim() throws Exception {
        BindingContractChecker.RoundTrip rt = BindingContractChecker.roundTrip(lower, "y = native{ weird  stuff }");
        assertEquals("y = native{ weird  stuff }", rt.regenerated());
        assertEquals(Tier.NATIVE, Conformance.level(rt.first().tree()));
    }

    @Test
    void dialectsAbstractToEquivalentTrees() throws Exception {
        assertTrue(BindingContractChecker.abstractionsEquivalent(lower, "x + 5", capitalized, "X + 5."));
        assertTrue(BindingContractChecker.abstractionsEquivalent(lower, "a = 1; b = a + a", capitalized, "A = 1, B = A + A."));
        assertFalse(BindingContractChecker.abstractionsEquivalent(lower, "x + 5", capitalized, "X - 5."));
    }

    @Test
    void parseErrorsCarryPosition() {
        ParseException e = assertThrows(ParseException.class, () -> lower.parse("x +\n  )"));
        assertEquals(2, e.line());
        assertEquals(3, e.column());
        assertThrows(ParseException.class, () -> capitalized.parse("x + 5."));
        assertThrows(ParseException.class, () -> capitalized.parse("X + 5"));
    }

    @Test
    void foreignEscapeIsNotReified() {
        MetaNode tree = BinaryOp.of(OperatorCategory.ARITHMETIC, "+", Variable.named("x"),
                info.isaksson.erland.metatree.ir.NativeEscape.of("mini", "native_block", "native{y}"));
        ReificationException e = assertThrows(ReificationException.class, () -> capitalized.reify(tree, java.util.Map.of()));
        assertEquals("erlmini", e.targetLanguage());
    }

    @Test
    void strictRoundTripKeepsUnitAndIsStable() throws Exception {
        BindingContractChecker.RoundTrip rt = BindingContractChecker.assertRoundTrip(lower, "a = 1; b = native{ q } + a");
        assertTrue(rt.sameMetadata());
        assertEquals("a = 1; b = native{ q } + a", rt.regenerated());
    }

    @Test
    void strictRoundTripReportsChangedUnit() {
        // Regenerated text that reads back as a different kind of unit fails even when the trees agree.
        MiniExprBinding forgetful = new MiniExprBinding() {
            private int calls;

            @Override public Abstraction abstractTree(MiniExprBinding.Program program) {
                Abstraction a = super.abstractTree(program);
                return calls++ == 0 ? a : new Abstraction(a.tree(), java.util.Map.of("unit", "other"));
            }
        };
        AssertionError e = assertThrows(AssertionError.class, () -> BindingContractChecker.assertRoundTrip(forgetful, "x + 5"));
        assertTrue(e.getMessage().contains("differently"), e.getMessage());
    }
}
