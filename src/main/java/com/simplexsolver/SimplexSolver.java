package com.simplexsolver;

import java.util.BitSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-phase primal simplex over a dense {@link Tableau}.
 *
 * <p>Phase 1 minimises the sum of artificial columns; a positive optimum proves the model
 * infeasible. Surviving basic artificials (at zero) are pivoted out, or their rows dropped
 * as linearly dependent, before Phase 2 minimises the real objective. Entering columns
 * follow Dantzig's rule until {@link SolverConfig#degenerateSwitch} consecutive
 * degenerate pivots, after which Bland's rule takes over for the rest of the solve.
 */
final class SimplexSolver {
    private static final Logger logger = LoggerFactory.getLogger(SimplexSolver.class);

    private enum Outcome { OPTIMAL, UNBOUNDED, ITERATION_LIMIT, STALLED }

    private final SolverConfig config;
    private final Tolerance tol;

    SimplexSolver(SolverConfig config) {
        this.config = config;
        this.tol = config.numeric();
    }

    /** Solves the LP relaxation of {@code model}; integrality flags are ignored. */
    LpResult solve(Model model) {
        StandardForm sf = StandardForm.of(model);
        Tableau t = sf.newTableau(tol, config.pivotTolerance);

        if (sf.numArtificial() > 0) {
            t.setObjective(sf.phase1Costs());
            Outcome phase1 = iterate(t);
            // the artificial sum is bounded below by zero, so "unbounded" here is numeric noise
            if (phase1 == Outcome.UNBOUNDED) return limit(Outcome.STALLED, t);
            if (phase1 != Outcome.OPTIMAL) return limit(phase1, t);
            if (tol.isPositive(t.objectiveValue())) {
                logger.debug("phase 1 optimum {} > 0: infeasible after {} pivots", t.objectiveValue(), t.pivots());
                return LpResult.of(SolveStatus.INFEASIBLE, t.pivots());
            }
            driveOutArtificials(t, sf);
            t.truncateColumns(sf.lastRealColumn());
            if (!t.isFeasible()) {
                logger.warn("basis left by phase 1 has a negative right-hand side beyond tolerance");
                return limit(Outcome.STALLED, t);
            }
            logger.debug("phase 1 done after {} pivots, {} rows remain", t.pivots(), t.m());
        }

        t.setObjective(sf.phase2Costs());
        Outcome phase2 = iterate(t);
        switch (phase2) {
            case OPTIMAL: break;
            case UNBOUNDED: return LpResult.of(SolveStatus.UNBOUNDED, t.pivots());
            default: return limit(phase2, t);
        }

        double[] x = sf.toModelValues(t.currentSolution());
        for (int j = 0; j < x.length; j++) x[j] = tol.clean(x[j]);
        double z = t.objectiveValue() + sf.objectiveConstant();
        logger.debug("relaxation optimal z={} after {} pivots", z, t.pivots());
        return LpResult.optimal(x, z, t.pivots());
    }

    private LpResult limit(Outcome outcome, Tableau t) {
        if (outcome == Outcome.STALLED) {
            logger.warn("simplex stalled after {} pivots: no improving column admits a usable pivot", t.pivots());
        } else {
            logger.warn("simplex iteration limit {} reached", config.iterationLimit);
        }
        return LpResult.of(SolveStatus.ITERATION_LIMIT_EXCEEDED, t.pivots());
    }

    /** Pivots until optimal, unbounded, stalled, or the pivot budget is spent. */
    private Outcome iterate(Tableau t) {
        Tableau.PivotRule rule = Tableau.PivotRule.DANTZIG;
        int degenerateRun = 0;
        while (true) {
            BitSet skipCols = new BitSet();
            boolean pivoted = false;
            while (!pivoted) {
                int e = t.enteringColumn(rule, skipCols);
                if (e == -1) return skipCols.isEmpty() ? Outcome.OPTIMAL : Outcome.STALLED;

                BitSet skipRows = new BitSet();
                double minRatio = Double.NaN;
                while (true) {
                    int r = t.leavingRow(e, rule, skipRows);
                    if (r == -1) {
                        if (!t.hasPositiveEntry(e)) {
                            logger.debug("column {} has no positive entry: unbounded", e);
                            return Outcome.UNBOUNDED;
                        }
                        skipCols.set(e);
                        break;
                    }
                    // a stand-in row must tie the minimum ratio, or the skipped rows go negative
                    if (skipRows.isEmpty()) {
                        minRatio = t.ratio(r, e);
                    } else if (!tol.equal(t.ratio(r, e), minRatio)) {
                        logger.debug("no tied row can replace the rejected pivot in column {}", e);
                        skipCols.set(e);
                        break;
                    }
                    if (t.pivots() >= config.iterationLimit) return Outcome.ITERATION_LIMIT;
                    boolean degenerate = tol.isZero(t.rhs(r));
                    try {
                        t.pivot(r, e);
                    } catch (DegeneratePivotException ex) {
                        logger.debug("rejected pivot at row {} col {}: {}", ex.row(), ex.column(), ex.getMessage());
                        skipRows.set(ex.row());
                        continue;
                    }
                    pivoted = true;
                    if (logger.isTraceEnabled()) logger.trace("pivot row {} col {}\n{}", r, e, t);
                    degenerateRun = degenerate ? degenerateRun + 1 : 0;
                    if (rule == Tableau.PivotRule.DANTZIG && degenerateRun >= config.degenerateSwitch) {
                        logger.debug("{} degenerate pivots in a row, switching to Bland's rule", degenerateRun);
                        rule = Tableau.PivotRule.BLAND;
                    }
                    break;
                }
            }
        }
    }

    /**
     * Replaces artificial columns still basic after Phase 1 (at value zero) by real columns.
     * A row with no usable real entry is a linear combination of the others and is removed.
     */
    private void driveOutArtificials(Tableau t, StandardForm sf) {
        int r = 1;
        while (r <= t.m()) {
            if (!sf.isArtificial(t.basicColumn(r))) { r++; continue; }
            int col = -1;
            double bestAbs = 0.0;
            for (int c = 1; c <= sf.lastRealColumn(); c++) {
                double a = Math.abs(t.value(r, c));
                if (a >= config.pivotTolerance && a > bestAbs) { col = c; bestAbs = a; }
            }
            if (col == -1) {
                logger.debug("row {} is redundant, removing it", r);
                t.removeRow(r);
                continue;
            }
            t.pivot(r, col);
            r++;
        }
    }
}
