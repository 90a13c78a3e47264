package com.simplexsolver;

public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE;

    /** Factor mapping this sense onto internal minimisation. */
    double sign() { return this == MAXIMIZE ? -1.0 : 1.0; }
}
