package com.simplexsolver;

/**
 * Gauss-Jordan elimination with partial pivoting for square systems {@code A x = b}.
 */
public final class LinearSystemSolver {

    private LinearSystemSolver() {}

    /**
     * @throws IllegalArgumentException if {@code A} is not square or does not match {@code b}
     * @throws ArithmeticException      if the rows are linearly dependent
     */
    public static double[] solve(double[][] A, double[] b, Tolerance tol) {
        final int n = b.length;
        if (A.length != n) throw new IllegalArgumentException("Expected " + n + " rows, got " + A.length);

        // build augmented matrix
        double[][] M = new double[n][n + 1];
        for (int i = 0; i < n; i++) {
            if (A[i].length != n) {
                throw new IllegalArgumentException("Row " + i + " has " + A[i].length + " entries, expected " + n);
            }
            System.arraycopy(A[i], 0, M[i], 0, n);
            M[i][n] = b[i];
        }

        for (int k = 0; k < n; k++) {
            // largest magnitude in column k at or below the diagonal
            int pivRow = k;
            double max = Math.abs(M[k][k]);
            for (int i = k + 1; i < n; i++) {
                double a = Math.abs(M[i][k]);
                if (a > max) { max = a; pivRow = i; }
            }
            if (tol.isZero(max)) throw new ArithmeticException("Singular system: rows are linearly dependent");

            if (pivRow != k) {
                double[] tmp = M[pivRow]; M[pivRow] = M[k]; M[k] = tmp;
            }

            // normalize pivot row
            double diag = M[k][k];
            for (int j = k; j <= n; j++) M[k][j] /= diag;

            // eliminate others
            for (int i = 0; i < n; i++) if (i != k) {
                double f = M[i][k];
                if (f == 0.0) continue;
                for (int j = k; j <= n; j++) M[i][j] -= f * M[k][j];
            }
        }

        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = tol.clean(M[i][n]);
        return x;
    }
}
