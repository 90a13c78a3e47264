package com.simplexsolver;

import java.util.Objects;

/** {@code expression relation rhs}. */
public final class Constraint {
    private final String name;
    private final LinearExpression expression;
    private final Relation relation;
    private final double rhs;

    Constraint(String name, LinearExpression expression, Relation relation, double rhs) {
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.relation = Objects.requireNonNull(relation, "relation");
        if (Double.isNaN(rhs) || Double.isInfinite(rhs)) {
            throw new IllegalArgumentException("Non-finite right-hand side on constraint " + name);
        }
        this.rhs = rhs;
    }

    public String name() { return name; }
    public LinearExpression expression() { return expression; }
    public Relation relation() { return relation; }
    public double rhs() { return rhs; }

    /** True if {@code values} satisfies this row within {@code eps}. */
    public boolean isSatisfied(double[] values, double eps) {
        return relation.holds(expression.evaluate(values), rhs, eps);
    }

    @Override
    public String toString() {
        return name + ": " + expression + " " + relation.symbol() + " " + rhs;
    }
}
