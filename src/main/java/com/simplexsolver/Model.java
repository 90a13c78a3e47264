package com.simplexsolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable LP/MIP description: ordered variables, constraint rows and an optional
 * objective. Build one with {@link #builder()}.
 *
 * <p>Every variable referenced by a row or by the objective exists in the model, and a
 * variable's index equals its position in {@link #variables()} for the model's lifetime.
 */
public final class Model {
    private final List<Variable> variables;
    private final List<Constraint> constraints;
    private final Objective objective;   // null for a pure feasibility model

    private Model(List<Variable> variables, List<Constraint> constraints, Objective objective) {
        this.variables = Collections.unmodifiableList(variables);
        this.constraints = Collections.unmodifiableList(constraints);
        this.objective = objective;
    }

    public static Builder builder() { return new Builder(); }

    public List<Variable> variables() { return variables; }
    public Variable variable(int index) { return variables.get(index); }
    public int numVariables() { return variables.size(); }
    public List<Constraint> constraints() { return constraints; }
    public int numConstraints() { return constraints.size(); }
    public Optional<Objective> objective() { return Optional.ofNullable(objective); }
    public boolean hasObjective() { return objective != null; }

    public boolean hasIntegerVariables() {
        for (Variable v : variables) if (v.isInteger()) return true;
        return false;
    }

    public double[] lowerBounds() {
        double[] lb = new double[variables.size()];
        for (int j = 0; j < lb.length; j++) lb[j] = variables.get(j).lower();
        return lb;
    }

    public double[] upperBounds() {
        double[] ub = new double[variables.size()];
        for (int j = 0; j < ub.length; j++) ub[j] = variables.get(j).upper();
        return ub;
    }

    /**
     * Same rows and objective over variables with replaced bounds. The arrays must have
     * one entry per variable with {@code lower[j] <= upper[j]}.
     */
    public Model withBounds(double[] lower, double[] upper) {
        if (lower.length != variables.size() || upper.length != variables.size()) {
            throw new IllegalArgumentException("Bound arrays must have " + variables.size() + " entries");
        }
        List<Variable> vs = new ArrayList<>(variables.size());
        for (Variable v : variables) vs.add(v.withBounds(lower[v.index()], upper[v.index()]));
        return new Model(vs, constraints, objective);
    }

    /** Bounds, rows and integrality all hold for {@code values} within {@code eps}. */
    public boolean isFeasible(double[] values, double eps) {
        if (values.length != variables.size()) return false;
        for (Variable v : variables) {
            double x = values[v.index()];
            if (x < v.lower() - eps || x > v.upper() + eps) return false;
            if (v.isInteger() && Math.abs(x - Math.rint(x)) > eps) return false;
        }
        for (Constraint c : constraints) if (!c.isSatisfied(values, eps)) return false;
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(objective == null ? "feasibility" : objective.toString()).append('\n');
        for (Constraint c : constraints) sb.append("  ").append(c).append('\n');
        for (Variable v : variables) sb.append("  ").append(v).append('\n');
        return sb.toString();
    }

    public static final class Builder {
        private final List<Variable> variables = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private Objective objective;

        private Builder() {}

        public Variable addVariable(String name, double lower, double upper, VariableType type) {
            Variable v = new Variable(variables.size(), name, lower, upper, type);
            variables.add(v);
            return v;
        }

        public Variable addVariable(double lower, double upper, VariableType type) {
            return addVariable("x" + variables.size(), lower, upper, type);
        }

        /** Non-negative variable, unbounded above ({@code [0, 1]} for binaries). */
        public Variable addVariable(VariableType type) {
            return addVariable(0.0, Double.POSITIVE_INFINITY, type);
        }

        public Variable continuous(double lower, double upper) {
            return addVariable(lower, upper, VariableType.CONTINUOUS);
        }

        public Variable integer(double lower, double upper) {
            return addVariable(lower, upper, VariableType.INTEGER);
        }

        public Variable binary() { return addVariable(VariableType.BINARY); }

        /** Adds {@code count} non-negative variables of one type. */
        public List<Variable> addVariables(int count, VariableType type) {
            List<Variable> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) out.add(addVariable(type));
            return out;
        }

        public Builder addConstraint(String name, LinearExpression expr, Relation relation, double rhs) {
            constraints.add(new Constraint(name, expr, relation, rhs));
            return this;
        }

        public Builder addConstraint(LinearExpression expr, Relation relation, double rhs) {
            return addConstraint("c" + constraints.size(), expr, relation, rhs);
        }

        /** Dense row over variables {@code 0..values.length-1}. */
        public Builder addRow(double[] values, Relation relation, double rhs) {
            return addConstraint(LinearExpression.of(values), relation, rhs);
        }

        public Builder objective(LinearExpression expr, ObjectiveSense sense, double constant) {
            this.objective = new Objective(expr, sense, constant);
            return this;
        }

        public Builder minimize(LinearExpression expr) { return objective(expr, ObjectiveSense.MINIMIZE, 0.0); }

        public Builder maximize(LinearExpression expr) { return objective(expr, ObjectiveSense.MAXIMIZE, 0.0); }

        public Model build() {
            int n = variables.size();
            for (Constraint c : constraints) {
                if (c.expression().maxIndex() >= n) {
                    throw new IllegalArgumentException("Constraint " + c.name()
                            + " references unknown variable x" + c.expression().maxIndex());
                }
            }
            if (objective != null && objective.expression().maxIndex() >= n) {
                throw new IllegalArgumentException("Objective references unknown variable x"
                        + objective.expression().maxIndex());
            }
            return new Model(new ArrayList<>(variables), new ArrayList<>(constraints), objective);
        }
    }
}
