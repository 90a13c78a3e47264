package com.simplexsolver;

import java.util.Objects;

/**
 * A decision variable. Identity is its index inside the owning {@link Model};
 * bounds may be infinite. Instances are immutable.
 */
public final class Variable {
    private final int index;
    private final String name;
    private final double lower;
    private final double upper;
    private final VariableType type;

    Variable(int index, String name, double lower, double upper, VariableType type) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("NaN bound on variable " + name);
        }
        if (type == VariableType.BINARY) {
            lower = Math.max(lower, 0.0);
            upper = Math.min(upper, 1.0);
        }
        if (lower > upper) {
            throw new IllegalArgumentException(
                    String.format("Lower bound %s > upper bound %s on variable %s", lower, upper, name));
        }
        if (lower == Double.POSITIVE_INFINITY || upper == Double.NEGATIVE_INFINITY) {
            throw new IllegalArgumentException("Empty domain on variable " + name);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public int index() { return index; }
    public String name() { return name; }
    public double lower() { return lower; }
    public double upper() { return upper; }
    public VariableType type() { return type; }
    public boolean isInteger() { return type.isInteger(); }

    /** Same variable with replaced bounds. */
    Variable withBounds(double lower, double upper) {
        return new Variable(index, name, lower, upper, type);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Variable)) return false;
        Variable o = (Variable) obj;
        return index == o.index && name.equals(o.name)
                && Double.compare(lower, o.lower) == 0 && Double.compare(upper, o.upper) == 0
                && type == o.type;
    }

    @Override
    public int hashCode() { return Objects.hash(index, name, lower, upper, type); }

    @Override
    public String toString() {
        return name + "[" + lower + ", " + upper + "]" + (isInteger() ? " int" : "");
    }
}
