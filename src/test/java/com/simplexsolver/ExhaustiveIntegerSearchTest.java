package com.simplexsolver;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class ExhaustiveIntegerSearchTest {

    private static Solution search(Model model) {
        return new ExhaustiveIntegerSearch(SolverConfig.defaults()).solve(model);
    }

    private static Model.Builder booleans(int n) {
        Model.Builder b = Model.builder();
        b.addVariables(n, VariableType.BINARY);
        return b;
    }

    @Test
    public void testOneVariable() {
        Model.Builder b = booleans(1);
        b.addRow(new double[]{ 1 }, Relation.EQUAL, 1);
        b.maximize(LinearExpression.of(1));
        Solution s = search(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertArrayEquals(new double[]{ 1 }, s.values(), 0.0);
        assertEquals(1.0, s.objective().getAsDouble(), 0.0);
    }

    @Test
    public void testNoObjectiveReturnsFirstFeasiblePoint() {
        Model.Builder b = booleans(1);
        b.addRow(new double[]{ 1 }, Relation.EQUAL, 1);
        Solution s = search(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertFalse(s.objective().isPresent());
        assertArrayEquals(new double[]{ 1 }, s.values(), 0.0);
    }

    @Test
    public void testThreeVariables() {
        Model.Builder b = booleans(3);
        b.addRow(new double[]{ 1, 0, 1 }, Relation.EQUAL, 2);
        b.addRow(new double[]{ 0, 1, 1 }, Relation.EQUAL, 2);
        b.maximize(LinearExpression.of(1, 2, 3));
        Solution s = search(b.build());
        assertArrayEquals(new double[]{ 1, 1, 1 }, s.values(), 0.0);
        assertEquals(6.0, s.objective().getAsDouble(), 0.0);
        assertEquals(8, s.stats().nodesSolved());
    }

    @Test
    public void testFiveVariables() {
        Model.Builder b = booleans(5);
        b.addRow(new double[]{ 1, 1, 1, 1, 1 }, Relation.EQUAL, 2);
        b.addRow(new double[]{ 3, 2, 1, 1, 2 }, Relation.EQUAL, 3);
        b.addRow(new double[]{ -2, -1, -1, -3, -2 }, Relation.EQUAL, -4);
        b.maximize(LinearExpression.of(4, 5, 3, 4, 5));
        Solution s = search(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertArrayEquals(new double[]{ 0, 1, 0, 1, 0 }, s.values(), 0.0);
        assertEquals(9.0, s.objective().getAsDouble(), 0.0);
    }

    @Test
    public void testContradictoryRowsAreInfeasible() {
        Model.Builder b = booleans(2);
        b.addRow(new double[]{ 1, 1 }, Relation.EQUAL, 1);
        b.addRow(new double[]{ 1, 1 }, Relation.EQUAL, 2);
        b.maximize(LinearExpression.of(1, 1));
        Solution s = search(b.build());
        assertEquals(SolveStatus.INFEASIBLE, s.status());
        assertFalse(s.hasAssignment());
    }

    @Test
    public void testAgreesWithBranchAndBound() {
        Model.Builder b = Model.builder();
        b.integer(0, 4);
        b.integer(-2, 3);
        b.integer(0, 5);
        b.addRow(new double[]{ 3, 2, 4 }, Relation.LESS_EQUAL, 13);
        b.addRow(new double[]{ 1, -1, 1 }, Relation.GREATER_EQUAL, 1);
        b.maximize(LinearExpression.of(5, 4, 6));
        Model model = b.build();

        Solution brute = search(model);
        Solution tree = new Solver().solve(model);
        assertEquals(SolveStatus.OPTIMAL, brute.status());
        assertEquals(SolveStatus.OPTIMAL, tree.status());
        assertEquals(brute.objective().getAsDouble(), tree.objective().getAsDouble(), 1e-7);
        assertTrue(model.isFeasible(tree.values(), 1e-7));
    }

    @Test
    public void testRejectsContinuousAndUnboundedVariables() {
        Model.Builder b = Model.builder();
        b.continuous(0, 1);
        Model continuous = b.build();
        assertThrows(IllegalArgumentException.class, () -> search(continuous));

        b = Model.builder();
        b.addVariable(VariableType.INTEGER);
        Model unbounded = b.build();
        assertThrows(IllegalArgumentException.class, () -> search(unbounded));
    }

    @Test
    public void testHugeFiniteBoundHitsNodeLimit() {
        Model.Builder b = Model.builder();
        b.integer(0, 1e19);
        b.addRow(new double[]{ 1 }, Relation.LESS_EQUAL, 3);
        b.maximize(LinearExpression.of(1));
        Solution s = search(b.build());
        assertEquals(SolveStatus.NODE_LIMIT_EXCEEDED, s.status());
        assertFalse(s.hasAssignment());
    }

    @Test
    public void testBoundsBeyondExactIntegersAreRejected() {
        // a single point, but x + 1 cannot be represented next to it
        Model.Builder b = Model.builder();
        b.integer(1e17, 1e17);
        b.maximize(LinearExpression.of(1));
        Model model = b.build();
        assertThrows(IllegalArgumentException.class, () -> search(model));
    }

    @Test
    public void testNegativeBounds() {
        Model.Builder b = Model.builder();
        b.integer(-3, -1);
        b.integer(-0.5, 2.5);
        b.addRow(new double[]{ 1, 1 }, Relation.GREATER_EQUAL, 0);
        b.minimize(LinearExpression.of(1, 1));
        Solution s = search(b.build());
        assertEquals(SolveStatus.OPTIMAL, s.status());
        assertEquals(0.0, s.objective().getAsDouble(), 0.0);
        assertArrayEquals(new double[]{ -2, 2 }, s.values(), 0.0);
        assertEquals(9, s.stats().nodesSolved());
    }

    @Test
    public void testNodeLimitCapsEnumeration() {
        SolverConfig cfg = SolverConfig.builder().nodeLimit(16).build();
        Model.Builder b = booleans(5);
        b.maximize(LinearExpression.of(1, 1, 1, 1, 1));
        Solution s = new ExhaustiveIntegerSearch(cfg).solve(b.build());
        assertEquals(SolveStatus.NODE_LIMIT_EXCEEDED, s.status());
        assertFalse(s.hasAssignment());
    }
}
