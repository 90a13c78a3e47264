package com.simplexsolver;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse linear combination {@code sum a_j x_j}. Zero coefficients are not stored and
 * terms are iterated in ascending variable index.
 */
public final class LinearExpression {
    private static final LinearExpression EMPTY = new LinearExpression(new int[0], new double[0]);

    private final int[] indices;      // strictly ascending
    private final double[] coeffs;    // nonzero

    private LinearExpression(int[] indices, double[] coeffs) {
        this.indices = indices;
        this.coeffs = coeffs;
    }

    public static LinearExpression empty() { return EMPTY; }

    /** Dense form: coefficient {@code k} belongs to variable {@code k}. */
    public static LinearExpression of(double... dense) {
        Builder b = builder();
        for (int j = 0; j < dense.length; j++) b.add(j, dense[j]);
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    public int size() { return indices.length; }
    public int index(int k) { return indices[k]; }
    public double coefficient(int k) { return coeffs[k]; }

    /** Coefficient of variable {@code index}, 0 if absent. */
    public double get(int index) {
        int k = Arrays.binarySearch(indices, index);
        return k >= 0 ? coeffs[k] : 0.0;
    }

    /** Largest referenced variable index, or -1 when empty. */
    public int maxIndex() { return indices.length == 0 ? -1 : indices[indices.length - 1]; }

    public double evaluate(double[] values) {
        double s = 0.0;
        for (int k = 0; k < indices.length; k++) s += coeffs[k] * values[indices[k]];
        return s;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LinearExpression)) return false;
        LinearExpression o = (LinearExpression) obj;
        return Arrays.equals(indices, o.indices) && Arrays.equals(coeffs, o.coeffs);
    }

    @Override
    public int hashCode() { return 31 * Arrays.hashCode(indices) + Arrays.hashCode(coeffs); }

    @Override
    public String toString() {
        if (indices.length == 0) return "0";
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < indices.length; k++) {
            double c = coeffs[k];
            if (k > 0) sb.append(c < 0 ? " - " : " + ");
            else if (c < 0) sb.append('-');
            sb.append(Math.abs(c)).append(" x").append(indices[k]);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final TreeMap<Integer, Double> terms = new TreeMap<>();

        private Builder() {}

        /** Adds {@code coeff} to the coefficient of {@code variable}. */
        public Builder add(Variable variable, double coeff) { return add(variable.index(), coeff); }

        public Builder add(int index, double coeff) {
            if (index < 0) throw new IllegalArgumentException("Negative variable index " + index);
            if (Double.isNaN(coeff) || Double.isInfinite(coeff)) {
                throw new IllegalArgumentException("Non-finite coefficient for x" + index + ": " + coeff);
            }
            terms.merge(index, coeff, Double::sum);
            return this;
        }

        public LinearExpression build() {
            int n = 0;
            for (double c : terms.values()) if (c != 0.0) n++;
            if (n == 0) return EMPTY;
            int[] idx = new int[n];
            double[] val = new double[n];
            int k = 0;
            for (Map.Entry<Integer, Double> e : terms.entrySet()) {
                if (e.getValue() == 0.0) continue;
                idx[k] = e.getKey();
                val[k] = e.getValue();
                k++;
            }
            return new LinearExpression(idx, val);
        }
    }
}
