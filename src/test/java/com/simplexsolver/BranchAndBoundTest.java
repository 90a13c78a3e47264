package com.simplexsolver;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import java.time.Duration;

public class BranchAndBoundTest {

    private static final double EPS = 1e-9;

    private static BranchAndBound bnb() {
        return new BranchAndBound(SolverConfig.defaults());
    }

    /** max x + y  s.t.  2x + y <= 5, x + 2y <= 5, x, y >= 0 integer. */
    private static Model symmetricMip() {
        Model.Builder b = Model.builder();
        b.addVariables(2, VariableType.INTEGER);
        b.addRow(new double[]{ 2, 1 }, Relation.LESS_EQUAL, 5);
        b.addRow(new double[]{ 1, 2 }, Relation.LESS_EQUAL, 5);
        b.maximize(LinearExpression.of(1, 1));
        return b.build();
    }

    /** max 10a + 13b + 7c + 8d  s.t.  3a + 4b + 2c + 3d <= 7, binary. */
    private static Model knapsack() {
        Model.Builder b = Model.builder();
        b.addVariables(4, VariableType.BINARY);
        b.addRow(new double[]{ 3, 4, 2, 3 }, Relation.LESS_EQUAL, 7);
        b.maximize(LinearExpression.of(10, 13, 7, 8));
        return b.build();
    }

    @Test
    public void testContinuousModelSolvesOneNode() {
        Model.Builder b = Model.builder();
        b.addVariables(2, VariableType.CONTINUOUS);
        b.addRow(new double[]{ 1, 1 }, Relation.LESS_EQUAL, 4);
        b.addRow(new double[]{ 1, 0 }, Relation.LESS_EQUAL, 3);
        b.maximize(LinearExpression.of(2, 3));

        Solution s = bnb().solve(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertEquals(12.0, s.objective().getAsDouble(), EPS);
        assertArrayEquals(new double[]{ 0, 4 }, s.values(), EPS);
        assertEquals(1, s.stats().nodesSolved());
        assertEquals(0, s.stats().maxDepth());
    }

    @Test
    public void testSymmetricMipBranchesOnce() {
        BranchAndBound.Search search = bnb().search(symmetricMip());
        assertEquals(SolveStatus.OPTIMAL, search.status);
        assertEquals(-3.0, search.incumbent.objective(), EPS);
        // root at (5/3, 5/3): both equally fractional, x branches; down child x <= 1 gives (1, 2)
        assertArrayEquals(new double[]{ 1, 2 }, search.incumbent.values(), EPS);

        BranchNode root = search.tree.get(0);
        assertEquals(BranchNode.State.BRANCHED, root.state());
        assertEquals(-10.0 / 3.0, root.relaxedObjective(), 1e-7);
        assertEquals(2, root.children().size());

        BranchNode down = search.tree.get(root.children().get(0));
        BranchNode up = search.tree.get(root.children().get(1));
        assertEquals(BranchNode.Direction.DOWN, down.direction);
        assertEquals(0, down.branchVariable);
        assertEquals(1.0, down.branchValue, EPS);
        assertEquals(BranchNode.State.ACCEPTED, down.state());
        // up child's bound ties the incumbent and cannot improve on it
        assertEquals(BranchNode.State.PRUNED, up.state());
        assertEquals(1, search.stats.nodesPruned());
    }

    @Test
    public void testMipWithSingleRow() {
        Model.Builder b = Model.builder();
        b.addVariables(2, VariableType.INTEGER);
        b.addRow(new double[]{ 2, 1 }, Relation.LESS_EQUAL, 5);
        b.maximize(LinearExpression.of(1, 1));

        Solution s = bnb().solve(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertEquals(5.0, s.objective().getAsDouble(), EPS);
        assertArrayEquals(new double[]{ 0, 5 }, s.values(), EPS);
    }

    @Test
    public void testBinaryKnapsack() {
        Solution s = bnb().solve(knapsack());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertEquals(23.0, s.objective().getAsDouble(), EPS);
        assertArrayEquals(new double[]{ 1, 1, 0, 0 }, s.values(), EPS);
        assertTrue(s.stats().nodesSolved() > 1);
        assertTrue(s.stats().incumbentUpdates() >= 1);
        assertTrue(knapsack().isFeasible(s.values(), EPS));
    }

    @Test
    public void testChildBoundsNeverBeatParent() {
        BranchAndBound.Search search = bnb().search(knapsack());
        for (BranchNode node : search.tree) {
            if (node.parent < 0 || Double.isNaN(node.relaxedObjective())) continue;
            BranchNode parent = search.tree.get(node.parent);
            assertTrue(node.relaxedObjective() >= parent.relaxedObjective() - 1e-9,
                    "node " + node.id + " improves on its parent");
            assertEquals(parent.relaxedObjective(), node.parentBound, 0.0);
            assertEquals(parent.depth + 1, node.depth);
        }
    }

    @Test
    public void testNodeLimitWithoutIncumbent() {
        SolverConfig cfg = SolverConfig.builder().nodeLimit(1).build();
        Solution s = new BranchAndBound(cfg).solve(symmetricMip());
        assertEquals(SolveStatus.NODE_LIMIT_EXCEEDED, s.status());
        assertFalse(s.hasAssignment());
        assertFalse(s.objective().isPresent());
        assertEquals(1, s.stats().nodesSolved());
    }

    @Test
    public void testNodeLimitKeepsIncumbent() {
        // the first dive reaches an integral leaf before the budget runs out
        SolverConfig cfg = SolverConfig.builder().nodeLimit(2).build();
        Solution s = new BranchAndBound(cfg).solve(symmetricMip());
        assertEquals(SolveStatus.NODE_LIMIT_EXCEEDED, s.status());
        assertTrue(s.hasAssignment());
        assertEquals(3.0, s.objective().getAsDouble(), EPS);
    }

    @Test
    public void testTimeLimit() {
        SolverConfig cfg = SolverConfig.builder().timeLimit(Duration.ofNanos(1)).build();
        Solution s = new BranchAndBound(cfg).solve(symmetricMip());
        assertEquals(SolveStatus.TIME_LIMIT_EXCEEDED, s.status());
        assertFalse(s.isProvenOptimal());
    }

    @Test
    public void testNoIntegerPointIsInfeasible() {
        // 2x = 1
        Model.Builder b = Model.builder();
        b.addVariable(VariableType.INTEGER);
        b.addRow(new double[]{ 2 }, Relation.EQUAL, 1);
        b.minimize(LinearExpression.of(1));

        Solution s = bnb().solve(b.build());
        assertEquals(SolveStatus.INFEASIBLE, s.status());
        assertFalse(s.hasAssignment());
        assertThrows(IllegalStateException.class, s::values);
        assertEquals(3, s.stats().nodesSolved());
    }

    @Test
    public void testUnboundedRoot() {
        Model.Builder b = Model.builder();
        b.addVariable(VariableType.INTEGER);
        b.maximize(LinearExpression.of(1));
        Solution s = bnb().solve(b.build());
        assertEquals(SolveStatus.UNBOUNDED, s.status());
        assertFalse(s.hasAssignment());
    }

    @Test
    public void testSelectBranchVariable() {
        Model.Builder b = Model.builder();
        b.addVariable(VariableType.CONTINUOUS);
        b.addVariables(3, VariableType.INTEGER);
        Model model = b.build();

        BranchAndBound solver = bnb();
        // continuous x0 is never chosen; x2 and x3 tie at 0.5 and the lower index wins
        assertEquals(2, solver.selectBranchVariable(model, new double[]{ 0.5, 2.3, 1.5, 3.5 }));
        assertEquals(1, solver.selectBranchVariable(model, new double[]{ 0.5, 2.45, 1.1, 3.0 }));
        assertEquals(-1, solver.selectBranchVariable(model, new double[]{ 0.5, 2.0, 1.0 + 1e-12, 3.0 }));
    }

    @Test
    public void testRepeatedSolvesAreIdentical() {
        Solution first = bnb().solve(knapsack());
        Solution second = bnb().solve(knapsack());
        assertArrayEquals(first.values(), second.values(), 0.0);
        assertEquals(first.stats().nodesSolved(), second.stats().nodesSolved());
        assertEquals(first.stats().simplexIterations(), second.stats().simplexIterations());
    }
}
