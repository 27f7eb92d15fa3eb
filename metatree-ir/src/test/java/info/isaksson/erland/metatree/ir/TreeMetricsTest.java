package info.isaksson.erland.metatree.ir;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TreeMetricsTest {

    @Test
    void flatExpressionHasDepthOne() {
        TreeMetrics m = TreeMetrics.of(Trees.xPlus5());
        assertEquals(1, m.depth());
        assertEquals(3, m.nodeCount());
        assertEquals(Set.of("x"), m.variables());
        assertEquals(0, m.nativeCount());
        assertEquals(Tier.CORE, m.level());
    }

    @Test
    void variableSetHasDistinctNames() {
        TreeMetrics m = TreeMetrics.of(Trees.twoAssignments());
        assertEquals(List.of("a", "b"), List.copyOf(m.variables()));
        assertEquals(2, m.distinctVariableCount());
    }

    @Test
    void siblingStatementsDoNotAddDepth() {
        MetaNode many = Block.of(List.of(Trees.xPlus5(), Trees.xPlus5(), Trees.xPlus5(), Trees.xPlus5()));
        assertEquals(1, TreeMetrics.depth(many));
    }

    @Test
    void depthGrowsWithEveryNewScope() {
        MetaNode current = Trees.xPlus5();
        int previous = TreeMetrics.depth(current);
        for (int i = 0; i < 10; i++) {
            current = Trees.nestIf(current);
            int depth = TreeMetrics.depth(current);
            assertTrue(depth > previous, "wrapping in a conditional must increase depth");
            previous = depth;
        }
        assertEquals(11, previous);
    }

    @Test
    void functionBodyAndHandlersEnterScopes() {
        assertEquals(2, TreeMetrics.depth(Trees.demoModule()));

        MetaNode handler = new MatchArm(Param.typed("e", "Exception"), null, List.of(Trees.xPlus5()), NodeMeta.EMPTY);
        MetaNode tryCatch = new ExceptionHandling(Block.of(List.of(Trees.xPlus5())), List.of((MatchArm) handler), null, NodeMeta.EMPTY);
        assertEquals(2, TreeMetrics.depth(tryCatch));
    }

    @Test
    void nodeCountIsAdditiveOverChildren() {
        for (MetaNode root : List.of(Trees.xPlus5(), Trees.twoAssignments(), Trees.demoModule())) {
            int sum = 1;
            for (MetaNode child : root.children()) sum += TreeMetrics.nodeCount(child);
            assertEquals(sum, TreeMetrics.nodeCount(root), root.tag().wireName());
            assertEquals(MetaNodes.preorder(root).size(), TreeMetrics.nodeCount(root));
        }
    }

    @Test
    void countsNativeEscapes() {
        TreeMetrics m = TreeMetrics.of(Trees.demoModule());
        assertEquals(1, m.nativeCount());
        assertEquals(Tier.NATIVE, m.level());
    }
}
