package com.simplexsolver;

/** Outcome of a solve. Only {@link #OPTIMAL} is a proof of optimality. */
public enum SolveStatus {
    OPTIMAL,
    /** No point satisfies every bound, row and integrality restriction. */
    INFEASIBLE,
    /** The objective improves without limit over the feasible region. */
    UNBOUNDED,
    /** A relaxation hit the pivot cap. */
    ITERATION_LIMIT_EXCEEDED,
    /** Branch-and-bound hit its node budget before proving optimality. */
    NODE_LIMIT_EXCEEDED,
    /** Branch-and-bound hit its time budget before proving optimality. */
    TIME_LIMIT_EXCEEDED;

    /** True for the budget statuses, which may still carry an incumbent. */
    public boolean isLimit() {
        return this == ITERATION_LIMIT_EXCEEDED || this == NODE_LIMIT_EXCEEDED || this == TIME_LIMIT_EXCEEDED;
    }
}
