package com.simplexsolver;

/** Integrality restriction of a {@link Variable}. */
public enum VariableType {
    CONTINUOUS,
    INTEGER,
    /** Integer restricted to {@code [0, 1]}. */
    BINARY;

    public boolean isInteger() { return this != CONTINUOUS; }
}
