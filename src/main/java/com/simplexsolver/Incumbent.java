package com.simplexsolver;

/**
 * Best integer-feasible point found by one search, in internal minimisation form.
 * Owned by a single driver call; never shared between solves.
 */
final class Incumbent {
    private final Tolerance tol;
    private double[] values;
    private double objective = Double.POSITIVE_INFINITY;

    Incumbent(Tolerance tol) { this.tol = tol; }

    boolean isPresent() { return values != null; }
    double objective() { return objective; }
    double[] values() { return values == null ? null : values.clone(); }

    /** A relaxation bound of {@code bound} could still hold a strictly better point. */
    boolean canImprove(double bound) {
        return values == null || tol.less(bound, objective);
    }

    /** Records the point if it is strictly better; returns whether it was recorded. */
    boolean offer(double[] point, double value) {
        if (!canImprove(value)) return false;
        this.values = point.clone();
        this.objective = value;
        return true;
    }
}
