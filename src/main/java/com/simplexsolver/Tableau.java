package com.simplexsolver;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Dense simplex tableau in canonical form.
 * Row 0 holds reduced costs with {@code -z} in column 0; rows 1..m hold the constraint
 * system with the right-hand side in column 0. Columns 1..n are standard-form columns,
 * all implicitly non-negative. {@code basis[r]} is the column basic in row r
 * ({@code basis[0]} is unused).
 */
final class Tableau {

    enum PivotRule { DANTZIG, BLAND }

    private double[][] T;
    private int[] basis;
    private int m, n;
    private final Tolerance tol;
    private final double pivotTolerance;

    private int pivots;

    Tableau(double[][] tableau, int[] basis, Tolerance tol, double pivotTolerance) {
        this.m = tableau.length - 1;
        this.n = m >= 0 ? tableau[0].length - 1 : -1;
        this.T = deepCopy(tableau);
        this.basis = Arrays.copyOf(basis, basis.length);
        this.tol = tol;
        this.pivotTolerance = pivotTolerance;
        sanity();
    }

    // --- Accessors
    int m() { return m; }
    int n() { return n; }
    int pivots() { return pivots; }
    double value(int r, int c) { return T[r][c]; }
    double rhs(int r) { return T[r][0]; }
    int basicColumn(int r) { return basis[r]; }
    double[][] tableau() { return deepCopy(T); }

    /** Current objective value {@code z}. */
    double objectiveValue() { return -T[0][0]; }

    /** Reduced cost of every column; index 0 is unused, basic columns read 0. */
    double[] reducedCosts() {
        double[] d = Arrays.copyOf(T[0], n + 1);
        d[0] = 0.0;
        for (int r = 1; r <= m; r++) d[basis[r]] = 0.0;
        return d;
    }

    /** Value of every column; index 0 is unused, non-basic columns read 0. */
    double[] currentSolution() {
        double[] x = new double[n + 1];
        for (int r = 1; r <= m; r++) x[basis[r]] = T[r][0];
        return x;
    }

    boolean isFeasible() {
        for (int r = 1; r <= m; r++) if (tol.isNegative(T[r][0])) return false;
        return true;
    }

    /**
     * Installs {@code costs} (index j = column j, index 0 ignored) as the objective row and
     * prices out the basic columns so the row holds reduced costs.
     */
    void setObjective(double[] costs) {
        if (costs.length != n + 1) throw new IllegalArgumentException("cost vector must have n+1 entries");
        T[0] = Arrays.copyOf(costs, n + 1);
        T[0][0] = 0.0;
        for (int r = 1; r <= m; r++) {
            double cb = T[0][basis[r]];
            if (cb == 0.0) continue;
            for (int c = 0; c <= n; c++) T[0][c] -= cb * T[r][c];
        }
    }

    /** Entering column under {@code rule}, skipping {@code skip}; -1 when none improves. */
    int enteringColumn(PivotRule rule, BitSet skip) {
        int best = -1;
        double bestCost = 0.0;
        for (int c = 1; c <= n; c++) {
            if (skip.get(c)) continue;
            double d = T[0][c];
            if (!tol.isNegative(d)) continue;
            if (rule == PivotRule.BLAND) return c;
            if (best == -1 || d < bestCost) { best = c; bestCost = d; }
        }
        return best;
    }

    /**
     * Minimum-ratio leaving row for {@code e}, skipping rows in {@code skip}; -1 when no
     * eligible row has a positive entry. Ratio ties go to the lowest row (DANTZIG) or to
     * the lowest basic column (BLAND).
     */
    int leavingRow(int e, PivotRule rule, BitSet skip) {
        int arg = -1;
        double best = 0.0;
        for (int r = 1; r <= m; r++) {
            if (skip.get(r)) continue;
            double a = T[r][e];
            if (!tol.isPositive(a)) continue;
            double ratio = ratio(r, e);
            if (arg == -1 || tol.less(ratio, best)) { arg = r; best = ratio; continue; }
            if (rule == PivotRule.BLAND && tol.equal(ratio, best) && basis[r] < basis[arg]) {
                arg = r; best = ratio;
            }
        }
        return arg;
    }

    /** Step length row {@code r} allows along column {@code e}; the entry must be positive. */
    double ratio(int r, int e) {
        return Math.max(T[r][0], 0.0) / T[r][e];
    }

    /** True if some row has a positive entry in column {@code e}. */
    boolean hasPositiveEntry(int e) {
        for (int r = 1; r <= m; r++) if (tol.isPositive(T[r][e])) return true;
        return false;
    }

    /**
     * Makes {@code enterCol} basic in {@code leaveRow}: scales the row to a unit pivot, then
     * eliminates the column from every other row, objective row included.
     *
     * @throws DegeneratePivotException if the pivot element is below the pivot tolerance
     */
    void pivot(int leaveRow, int enterCol) {
        double piv = T[leaveRow][enterCol];
        if (Math.abs(piv) < pivotTolerance) throw new DegeneratePivotException(leaveRow, enterCol, piv);

        double[] pr = T[leaveRow];
        for (int c = 0; c <= n; c++) pr[c] /= piv;
        pr[enterCol] = 1.0;

        for (int r = 0; r <= m; r++) {
            if (r == leaveRow) continue;
            double factor = T[r][enterCol];
            if (factor == 0.0) continue;
            double[] row = T[r];
            for (int c = 0; c <= n; c++) row[c] -= factor * pr[c];
            row[enterCol] = 0.0;
        }

        basis[leaveRow] = enterCol;
        pivots++;
    }

    /** Drops constraint row {@code r}; its basic column becomes non-basic. */
    void removeRow(int r) {
        if (r < 1 || r > m) throw new IllegalArgumentException("row out of range: " + r);
        double[][] nt = new double[m][];
        int[] nb = new int[m];
        for (int i = 0, k = 0; i <= m; i++) {
            if (i == r) continue;
            nt[k] = T[i];
            nb[k] = basis[i];
            k++;
        }
        T = nt;
        basis = nb;
        m--;
    }

    /** Keeps columns {@code 0..keep}; none of the dropped columns may be basic. */
    void truncateColumns(int keep) {
        if (keep > n) throw new IllegalArgumentException("cannot grow tableau");
        for (int r = 1; r <= m; r++) {
            if (basis[r] > keep) throw new IllegalStateException("column " + basis[r] + " is still basic");
        }
        for (int r = 0; r <= m; r++) T[r] = Arrays.copyOf(T[r], keep + 1);
        n = keep;
    }

    private static double[][] deepCopy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = Arrays.copyOf(a[i], a[i].length);
        return c;
    }

    private void sanity() {
        if (m < 0) throw new IllegalArgumentException("tableau needs an objective row");
        for (double[] row : T) {
            if (row.length != n + 1) throw new IllegalArgumentException("tableau col count mismatch");
        }
        if (basis.length != m + 1) throw new IllegalArgumentException("basis length mismatch");
        for (int r = 1; r <= m; r++) {
            int b = basis[r];
            if (b < 1 || b > n) throw new IllegalArgumentException("basic column out of range in row " + r);
            for (int i = 1; i <= m; i++) {
                double want = i == r ? 1.0 : 0.0;
                if (!tol.equal(T[i][b], want)) {
                    throw new IllegalArgumentException("column " + b + " is not a unit vector for row " + r);
                }
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r <= m; r++) {
            sb.append(r == 0 ? "  z" : String.format("%3d", basis[r])).append(" |");
            for (int c = 0; c <= n; c++) sb.append(String.format(" %10.4f", T[r][c]));
            sb.append('\n');
        }
        return sb.toString();
    }
}
