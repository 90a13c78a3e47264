package com.simplexsolver;

import java.time.Duration;

/** Immutable solver settings: numeric tolerances and search budgets. */
public final class SolverConfig {
    public static final double DEFAULT_TOLERANCE = 1e-9;
    public static final double DEFAULT_PIVOT_TOLERANCE = 1e-7;
    public static final long DEFAULT_ITERATION_LIMIT = 1_000_000L;
    public static final long DEFAULT_NODE_LIMIT = 100_000L;
    public static final int DEFAULT_DEGENERATE_SWITCH = 50;

    private static final SolverConfig DEFAULTS = builder().build();

    public final double tolerance;          // zero test for costs, ratios, bound violations
    public final double pivotTolerance;     // smallest accepted pivot magnitude
    public final long iterationLimit;       // pivots per relaxation (both phases)
    public final long nodeLimit;            // branch-and-bound nodes solved
    public final Duration timeLimit;        // null = unlimited
    public final int degenerateSwitch;      // consecutive degenerate pivots before Bland's rule

    private SolverConfig(Builder b) {
        this.tolerance = b.tolerance;
        this.pivotTolerance = b.pivotTolerance;
        this.iterationLimit = b.iterationLimit;
        this.nodeLimit = b.nodeLimit;
        this.timeLimit = b.timeLimit;
        this.degenerateSwitch = b.degenerateSwitch;
    }

    public static SolverConfig defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    Tolerance numeric() { return new Tolerance(tolerance); }

    public Builder toBuilder() {
        return builder().tolerance(tolerance).pivotTolerance(pivotTolerance)
                .iterationLimit(iterationLimit).nodeLimit(nodeLimit)
                .timeLimit(timeLimit).degenerateSwitch(degenerateSwitch);
    }

    @Override
    public String toString() {
        return "SolverConfig{tolerance=" + tolerance + ", pivotTolerance=" + pivotTolerance
                + ", iterationLimit=" + iterationLimit + ", nodeLimit=" + nodeLimit
                + ", timeLimit=" + timeLimit + ", degenerateSwitch=" + degenerateSwitch + '}';
    }

    public static final class Builder {
        private double tolerance = DEFAULT_TOLERANCE;
        private double pivotTolerance = DEFAULT_PIVOT_TOLERANCE;
        private long iterationLimit = DEFAULT_ITERATION_LIMIT;
        private long nodeLimit = DEFAULT_NODE_LIMIT;
        private Duration timeLimit;
        private int degenerateSwitch = DEFAULT_DEGENERATE_SWITCH;

        private Builder() {}

        public Builder tolerance(double v){ this.tolerance=v; return this; }
        public Builder pivotTolerance(double v){ this.pivotTolerance=v; return this; }
        public Builder iterationLimit(long v){ this.iterationLimit=v; return this; }
        public Builder nodeLimit(long v){ this.nodeLimit=v; return this; }
        public Builder timeLimit(Duration v){ this.timeLimit=v; return this; }
        public Builder degenerateSwitch(int v){ this.degenerateSwitch=v; return this; }

        /** Raises the pivot tolerance to the zero tolerance when it would fall below it. */
        public SolverConfig build() {
            if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
                throw new IllegalArgumentException("tolerance must be positive and finite: " + tolerance);
            }
            if (!(pivotTolerance > 0) || Double.isInfinite(pivotTolerance)) {
                throw new IllegalArgumentException("pivotTolerance must be positive and finite: " + pivotTolerance);
            }
            if (iterationLimit <= 0) throw new IllegalArgumentException("iterationLimit must be positive: " + iterationLimit);
            if (nodeLimit <= 0) throw new IllegalArgumentException("nodeLimit must be positive: " + nodeLimit);
            if (degenerateSwitch <= 0) throw new IllegalArgumentException("degenerateSwitch must be positive: " + degenerateSwitch);
            if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
                throw new IllegalArgumentException("timeLimit must be positive: " + timeLimit);
            }
            pivotTolerance = Math.max(pivotTolerance, tolerance);
            return new SolverConfig(this);
        }
    }
}
