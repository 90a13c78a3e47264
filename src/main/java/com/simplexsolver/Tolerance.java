package com.simplexsolver;

/** Absolute-tolerance comparisons shared by every numeric component. */
public final class Tolerance {
    private final double eps;

    public Tolerance(double eps) {
        if (!(eps > 0)) throw new IllegalArgumentException("tolerance must be positive: " + eps);
        this.eps = eps;
    }

    public double epsilon() { return eps; }

    public boolean isZero(double v) { return Math.abs(v) <= eps; }
    public boolean isPositive(double v) { return v > eps; }
    public boolean isNegative(double v) { return v < -eps; }

    /** {@code a} and {@code b} agree within tolerance. */
    public boolean equal(double a, double b) { return Math.abs(a - b) <= eps; }

    /** {@code a} is smaller than {@code b} by more than the tolerance. */
    public boolean less(double a, double b) { return a < b - eps; }

    public boolean isIntegral(double v) { return Math.abs(v - Math.rint(v)) <= eps; }

    /** Distance of {@code v} from the nearest integer, in {@code [0, 0.5]}. */
    public static double fractionality(double v) { return Math.abs(v - Math.rint(v)); }

    /** Snaps values within tolerance of zero to exactly zero. */
    public double clean(double v) { return isZero(v) ? 0.0 : v; }

    @Override
    public String toString() { return "Tolerance{" + eps + '}'; }
}
