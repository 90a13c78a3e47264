package com.simplexsolver;

import java.util.Objects;

/** Linear objective with a sense and a constant offset. */
public final class Objective {
    private final LinearExpression expression;
    private final ObjectiveSense sense;
    private final double constant;

    Objective(LinearExpression expression, ObjectiveSense sense, double constant) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.sense = Objects.requireNonNull(sense, "sense");
        if (Double.isNaN(constant) || Double.isInfinite(constant)) {
            throw new IllegalArgumentException("Non-finite objective constant " + constant);
        }
        this.constant = constant;
    }

    public LinearExpression expression() { return expression; }
    public ObjectiveSense sense() { return sense; }
    public double constant() { return constant; }

    /** Objective value of {@code values}, constant included. */
    public double evaluate(double[] values) { return expression.evaluate(values) + constant; }

    @Override
    public String toString() {
        return sense.name().toLowerCase() + " " + expression + (constant != 0.0 ? " + " + constant : "");
    }
}
