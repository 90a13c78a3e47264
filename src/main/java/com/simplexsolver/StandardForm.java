package com.simplexsolver;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a {@link Model} into a canonical simplex tableau over non-negative columns
 * and maps column values back onto model variables.
 *
 * <pre>
 *   finite lower l:          x = l + p          (plus row  p &lt;= u - l  when u is finite)
 *   only upper u finite:     x = u - p
 *   free:                    x = p - q
 * </pre>
 *
 * Column layout: structural columns first, then one slack/surplus per inequality row,
 * then artificial columns. Every row is sign-normalised to a non-negative right-hand
 * side; rows whose slack cannot start basic (equalities and {@code >=} rows) receive an
 * artificial column, which is what Phase 1 drives to zero.
 */
final class StandardForm {
    private static final Logger logger = LoggerFactory.getLogger(StandardForm.class);

    private enum Kind { SHIFTED, MIRRORED, FREE }

    private final Kind[] kind;          // per model variable
    private final double[] offset;      // per model variable
    private final int[] column;         // first column of each model variable
    private final int numStructural;
    private final int numSlack;
    private final int numArtificial;
    private final double[] phase2Costs; // length numStructural + numSlack + 1
    private final double objectiveConstant;
    private final double[][] T;
    private final int[] basis;

    private StandardForm(Kind[] kind, double[] offset, int[] column, int numStructural, int numSlack,
                         int numArtificial, double[] phase2Costs, double objectiveConstant,
                         double[][] T, int[] basis) {
        this.kind = kind;
        this.offset = offset;
        this.column = column;
        this.numStructural = numStructural;
        this.numSlack = numSlack;
        this.numArtificial = numArtificial;
        this.phase2Costs = phase2Costs;
        this.objectiveConstant = objectiveConstant;
        this.T = T;
        this.basis = basis;
    }

    int numStructural() { return numStructural; }
    int numSlack() { return numSlack; }
    int numArtificial() { return numArtificial; }
    int numRows() { return T.length - 1; }

    /** Last column that is not artificial. */
    int lastRealColumn() { return numStructural + numSlack; }

    boolean isArtificial(int col) { return col > lastRealColumn(); }

    /** Internal (minimisation) objective constant from bound shifts. */
    double objectiveConstant() { return objectiveConstant; }

    /** Fresh tableau with the initial slack/artificial basis and a zero objective row. */
    Tableau newTableau(Tolerance tol, double pivotTolerance) {
        return new Tableau(T, basis, tol, pivotTolerance);
    }

    /** Phase-1 costs: 1 on every artificial column. */
    double[] phase1Costs() {
        double[] c = new double[lastRealColumn() + numArtificial + 1];
        for (int j = lastRealColumn() + 1; j < c.length; j++) c[j] = 1.0;
        return c;
    }

    /** Phase-2 costs over the non-artificial columns. */
    double[] phase2Costs() { return phase2Costs.clone(); }

    /** Model variable values from tableau column values. */
    double[] toModelValues(double[] columnValues) {
        double[] x = new double[kind.length];
        for (int j = 0; j < kind.length; j++) {
            int c = column[j];
            switch (kind[j]) {
                case SHIFTED: x[j] = offset[j] + columnValues[c]; break;
                case MIRRORED: x[j] = offset[j] - columnValues[c]; break;
                default: x[j] = columnValues[c] - columnValues[c + 1];
            }
        }
        return x;
    }

    static StandardForm of(Model model) {
        final int nv = model.numVariables();
        Kind[] kind = new Kind[nv];
        double[] offset = new double[nv];
        int[] column = new int[nv];

        // Structural columns
        int next = 1;
        List<double[]> boundRows = new ArrayList<>();   // {column, u - l}
        for (Variable v : model.variables()) {
            int j = v.index();
            column[j] = next;
            boolean lowFinite = v.lower() != Double.NEGATIVE_INFINITY;
            boolean upFinite = v.upper() != Double.POSITIVE_INFINITY;
            if (lowFinite) {
                kind[j] = Kind.SHIFTED;
                offset[j] = v.lower();
                if (upFinite) boundRows.add(new double[]{ next, v.upper() - v.lower() });
                next += 1;
            } else if (upFinite) {
                kind[j] = Kind.MIRRORED;
                offset[j] = v.upper();
                next += 1;
            } else {
                kind[j] = Kind.FREE;
                next += 2;
            }
        }
        final int ns = next - 1;

        // Rows over structural columns, before slacks: coefficients, relation, rhs
        List<double[]> rowCoeffs = new ArrayList<>();
        List<Relation> rowRel = new ArrayList<>();
        List<Double> rowRhs = new ArrayList<>();
        for (Constraint con : model.constraints()) {
            double[] a = new double[ns + 1];
            double b = con.rhs();
            LinearExpression e = con.expression();
            for (int k = 0; k < e.size(); k++) {
                int j = e.index(k);
                double coef = e.coefficient(k);
                int c = column[j];
                switch (kind[j]) {
                    case SHIFTED: a[c] += coef; b -= coef * offset[j]; break;
                    case MIRRORED: a[c] -= coef; b -= coef * offset[j]; break;
                    default: a[c] += coef; a[c + 1] -= coef;
                }
            }
            rowCoeffs.add(a);
            rowRel.add(con.relation());
            rowRhs.add(b);
        }
        for (double[] br : boundRows) {
            double[] a = new double[ns + 1];
            a[(int) br[0]] = 1.0;
            rowCoeffs.add(a);
            rowRel.add(Relation.LESS_EQUAL);
            rowRhs.add(br[1]);
        }

        // Sign-normalise and count slacks / artificials
        final int m = rowCoeffs.size();
        int slacks = 0, artificials = 0;
        for (int i = 0; i < m; i++) {
            // a zero-rhs ">=" row flips to "<=" so its slack can start basic
            if (rowRhs.get(i) < 0 || (rowRhs.get(i) == 0.0 && rowRel.get(i) == Relation.GREATER_EQUAL)) {
                double[] a = rowCoeffs.get(i);
                for (int c = 1; c <= ns; c++) a[c] = -a[c];
                rowRhs.set(i, rowRhs.get(i) == 0.0 ? 0.0 : -rowRhs.get(i));
                rowRel.set(i, flip(rowRel.get(i)));
            }
            if (rowRel.get(i) != Relation.EQUAL) slacks++;
            if (rowRel.get(i) != Relation.LESS_EQUAL) artificials++;
        }

        final int n = ns + slacks + artificials;
        double[][] T = new double[m + 1][n + 1];
        int[] basis = new int[m + 1];
        int slackCol = ns + 1, artCol = ns + slacks + 1;
        for (int i = 0; i < m; i++) {
            int r = i + 1;
            double[] a = rowCoeffs.get(i);
            System.arraycopy(a, 1, T[r], 1, ns);
            T[r][0] = rowRhs.get(i);
            switch (rowRel.get(i)) {
                case LESS_EQUAL:
                    T[r][slackCol] = 1.0;
                    basis[r] = slackCol++;
                    break;
                case GREATER_EQUAL:
                    T[r][slackCol++] = -1.0;
                    T[r][artCol] = 1.0;
                    basis[r] = artCol++;
                    break;
                default:
                    T[r][artCol] = 1.0;
                    basis[r] = artCol++;
            }
        }

        // Phase-2 costs in minimisation form
        double[] costs = new double[ns + slacks + 1];
        double constant = 0.0;
        Objective obj = model.objective().orElse(null);
        if (obj != null) {
            double sign = obj.sense().sign();
            LinearExpression e = obj.expression();
            for (int k = 0; k < e.size(); k++) {
                int j = e.index(k);
                double coef = sign * e.coefficient(k);
                int c = column[j];
                switch (kind[j]) {
                    case SHIFTED: costs[c] += coef; constant += coef * offset[j]; break;
                    case MIRRORED: costs[c] -= coef; constant += coef * offset[j]; break;
                    default: costs[c] += coef; costs[c + 1] -= coef;
                }
            }
        }

        logger.debug("standard form: {} rows, {} structural, {} slack, {} artificial columns",
                m, ns, slacks, artificials);
        return new StandardForm(kind, offset, column, ns, slacks, artificials, costs, constant, T, basis);
    }

    private static Relation flip(Relation r) {
        switch (r) {
            case LESS_EQUAL: return Relation.GREATER_EQUAL;
            case GREATER_EQUAL: return Relation.LESS_EQUAL;
            default: return Relation.EQUAL;
        }
    }
}
