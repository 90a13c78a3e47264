package com.simplexsolver;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable result of a solve. An assignment is present for {@link SolveStatus#OPTIMAL}
 * and for budget statuses that found an incumbent; the objective is present whenever an
 * assignment is and the model has an objective.
 */
public final class Solution {
    private final SolveStatus status;
    private final double[] values;      // null when no assignment
    private final double objective;     // NaN when absent
    private final SolveStats stats;

    Solution(SolveStatus status, double[] values, double objective, SolveStats stats) {
        this.status = Objects.requireNonNull(status, "status");
        this.values = values == null ? null : values.clone();
        this.objective = objective;
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public SolveStatus status() { return status; }

    public boolean isProvenOptimal() { return status == SolveStatus.OPTIMAL; }

    public boolean hasAssignment() { return values != null; }

    public OptionalDouble objective() {
        return Double.isNaN(objective) ? OptionalDouble.empty() : OptionalDouble.of(objective);
    }

    /** Copy of the assignment indexed by variable index. */
    public double[] values() {
        if (values == null) throw new IllegalStateException("No assignment for status " + status);
        return values.clone();
    }

    public double value(int index) {
        if (values == null) throw new IllegalStateException("No assignment for status " + status);
        return values[index];
    }

    public double value(Variable variable) { return value(variable.index()); }

    public SolveStats stats() { return stats; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Status = ").append(status).append('\n');
        if (!Double.isNaN(objective)) sb.append(String.format("Objective = %.6f%n", objective));
        if (values != null) {
            for (int j = 0; j < values.length; j++) sb.append(String.format("x[%d] = %.6f%n", j, values[j]));
        }
        return sb.toString();
    }
}
