package com.simplexsolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One subproblem of the branch-and-bound tree: the model's bounds tightened by every
 * branching decision on the path from the root. Nodes live in the driver's arena and
 * refer to each other by id only.
 */
final class BranchNode {

    /** UNEXPLORED, then a relaxation outcome, then how the node was resolved. */
    enum State { UNEXPLORED, INTEGRAL, FRACTIONAL, INFEASIBLE, UNBOUNDED, PRUNED, ACCEPTED, BRANCHED }

    enum Direction { DOWN, UP }

    final int id;
    final int parent;           // -1 for the root
    final int depth;
    final int branchVariable;   // -1 for the root
    final Direction direction;  // null for the root
    final double branchValue;   // new upper (DOWN) or lower (UP) bound
    final double parentBound;   // parent's relaxed objective, -inf for the root

    private double[] lower;
    private double[] upper;
    private State state = State.UNEXPLORED;
    private double relaxedObjective = Double.NaN;
    private final List<Integer> children = new ArrayList<>(2);

    private BranchNode(int id, int parent, int depth, int branchVariable, Direction direction,
                       double branchValue, double parentBound, double[] lower, double[] upper) {
        this.id = id;
        this.parent = parent;
        this.depth = depth;
        this.branchVariable = branchVariable;
        this.direction = direction;
        this.branchValue = branchValue;
        this.parentBound = parentBound;
        this.lower = lower;
        this.upper = upper;
    }

    static BranchNode root(double[] lower, double[] upper) {
        return new BranchNode(0, -1, 0, -1, null, Double.NaN, Double.NEGATIVE_INFINITY,
                lower.clone(), upper.clone());
    }

    /** Child inheriting this node's bounds plus one new bound on {@code variable}. */
    BranchNode child(int id, int variable, Direction dir, double value) {
        double[] lo = lower.clone();
        double[] up = upper.clone();
        if (dir == Direction.DOWN) up[variable] = Math.min(up[variable], value);
        else lo[variable] = Math.max(lo[variable], value);
        children.add(id);
        return new BranchNode(id, this.id, depth + 1, variable, dir, value, relaxedObjective, lo, up);
    }

    /** Some variable's bounds cross, so the subproblem is empty. */
    boolean hasCrossedBounds() {
        for (int j = 0; j < lower.length; j++) if (lower[j] > upper[j]) return true;
        return false;
    }

    double[] lower() { return lower; }
    double[] upper() { return upper; }
    State state() { return state; }
    double relaxedObjective() { return relaxedObjective; }
    List<Integer> children() { return Collections.unmodifiableList(children); }

    void solved(State outcome, double objective) {
        this.state = outcome;
        this.relaxedObjective = objective;
    }

    /** Final state; drops the bound arrays, which a resolved node no longer needs. */
    void resolve(State fate) {
        this.state = fate;
        this.lower = null;
        this.upper = null;
    }

    @Override
    public String toString() {
        String decision = parent < 0 ? "root"
                : "x" + branchVariable + (direction == Direction.DOWN ? " <= " : " >= ") + branchValue;
        return "node " + id + " (" + decision + ", depth " + depth + ") " + state
                + (Double.isNaN(relaxedObjective) ? "" : " z=" + relaxedObjective);
    }
}
