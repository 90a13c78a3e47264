package com.simplexsolver;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates every integer point of a small pure-integer model with finite bounds and keeps
 * the best feasible one. Exponential in the number of variables; meant for small models
 * and for cross-checking {@link BranchAndBound}.
 */
public final class ExhaustiveIntegerSearch {
    private static final Logger logger = LoggerFactory.getLogger(ExhaustiveIntegerSearch.class);

    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;   // 2^53

    private final SolverConfig config;
    private final Tolerance tol;

    public ExhaustiveIntegerSearch(SolverConfig config) {
        this.config = config;
        this.tol = config.numeric();
    }

    /**
     * @throws IllegalArgumentException if a variable is continuous, has an infinite bound, or a
     *                                  bound too large to step through exactly within the point budget
     */
    public Solution solve(Model model) {
        final long t0 = System.nanoTime();
        final int n = model.numVariables();
        double[] lo = new double[n];
        double[] hi = new double[n];
        double points = 1.0;
        for (Variable v : model.variables()) {
            if (!v.isInteger()) {
                throw new IllegalArgumentException("Exhaustive search needs integer variables, " + v.name() + " is continuous");
            }
            if (Double.isInfinite(v.lower()) || Double.isInfinite(v.upper())) {
                throw new IllegalArgumentException("Exhaustive search needs finite bounds on " + v.name());
            }
            lo[v.index()] = Math.ceil(v.lower() - tol.epsilon()) + 0.0;
            hi[v.index()] = Math.floor(v.upper() + tol.epsilon()) + 0.0;
            points *= Math.max(0.0, hi[v.index()] - lo[v.index()] + 1.0);
        }

        SolveStats stats = new SolveStats();
        if (points > config.nodeLimit) {
            logger.warn("{} candidate points exceed the node limit {}", points, config.nodeLimit);
            stats.elapsed(Duration.ofNanos(System.nanoTime() - t0));
            return SolutionReporter.report(model, SolveStatus.NODE_LIMIT_EXCEEDED, stats);
        }

        LinearExpression obj = model.objective().map(Objective::expression).orElse(LinearExpression.empty());
        double sign = model.objective().map(o -> o.sense().sign()).orElse(1.0);
        Incumbent incumbent = new Incumbent(tol);
        double[] x = new double[n];
        if (points > 0) {
            for (int j = 0; j < n; j++) {
                // beyond 2^53 the odometer step x + 1 is lost to rounding
                if (Math.abs(lo[j]) > MAX_EXACT_INTEGER || Math.abs(hi[j]) > MAX_EXACT_INTEGER) {
                    throw new IllegalArgumentException("Bounds of " + model.variable(j).name() + " exceed 2^53");
                }
                x[j] = lo[j];
            }
            // odometer over the box, last variable fastest
            while (true) {
                stats.nodeSolved(n);
                if (model.isFeasible(x, tol.epsilon()) && incumbent.offer(x, sign * obj.evaluate(x))) {
                    stats.incumbentUpdated();
                }
                int j = n - 1;
                while (j >= 0 && x[j] >= hi[j]) { x[j] = lo[j]; j--; }
                if (j < 0) break;
                x[j] += 1;
            }
        }

        stats.elapsed(Duration.ofNanos(System.nanoTime() - t0));
        SolveStatus status = incumbent.isPresent() ? SolveStatus.OPTIMAL : SolveStatus.INFEASIBLE;
        logger.info("exhaustive search {}: {}", status, stats);
        return SolutionReporter.report(model, status, incumbent.values(), incumbent.objective(), stats);
    }
}
