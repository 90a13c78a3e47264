package com.simplexsolver;

/**
 * Outcome of one LP relaxation. {@code objective} is in internal minimisation form
 * (maximisation negated, objective constant excluded).
 */
final class LpResult {
    final SolveStatus status;
    final double[] values;      // model variable values; null unless OPTIMAL
    final double objective;
    final long iterations;

    private LpResult(SolveStatus status, double[] values, double objective, long iterations) {
        this.status = status;
        this.values = values;
        this.objective = objective;
        this.iterations = iterations;
    }

    static LpResult optimal(double[] values, double objective, long iterations) {
        return new LpResult(SolveStatus.OPTIMAL, values, objective, iterations);
    }

    static LpResult of(SolveStatus status, long iterations) {
        if (status == SolveStatus.OPTIMAL) throw new IllegalArgumentException("optimal result needs values");
        return new LpResult(status, null, Double.NaN, iterations);
    }

    boolean isOptimal() { return status == SolveStatus.OPTIMAL; }

    @Override
    public String toString() {
        return status + (isOptimal() ? " z=" + objective : "") + " after " + iterations + " pivots";
    }
}
