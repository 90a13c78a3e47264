package com.simplexsolver;

/**
 * Pivot element too small to divide by safely. The caller picks another leaving row;
 * the exception never leaves the simplex solver.
 */
final class DegeneratePivotException extends RuntimeException {
    private final int row;
    private final int column;

    DegeneratePivotException(int row, int column, double element) {
        super("Pivot element " + element + " at (" + row + "," + column + ") is below pivot tolerance");
        this.row = row;
        this.column = column;
    }

    int row() { return row; }
    int column() { return column; }
}
