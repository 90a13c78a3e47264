package com.simplexsolver;

/** Relation between the left- and right-hand side of a {@link Constraint}. */
public enum Relation {
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL("=");

    private final String symbol;

    Relation(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    /** True if {@code lhs rel rhs} holds with slack {@code eps}. */
    public boolean holds(double lhs, double rhs, double eps) {
        switch (this) {
            case LESS_EQUAL: return lhs <= rhs + eps;
            case GREATER_EQUAL: return lhs >= rhs - eps;
            default: return Math.abs(lhs - rhs) <= eps;
        }
    }
}
