package com.simplexsolver;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: solves a {@link Model} and reports the outcome as a {@link Solution}.
 *
 * <p>Models with an objective go through branch-and-bound, which is a single simplex solve
 * when no variable is integer. Models without an objective are feasibility problems; a
 * continuous square system of equalities over free variables is first tried with Gaussian
 * elimination and falls back to the simplex route when singular.
 *
 * <p>Solver outcomes never surface as exceptions; see {@link SolveStatus}. Instances hold
 * only their immutable configuration and can be shared.
 */
public final class Solver {
    private static final Logger logger = LoggerFactory.getLogger(Solver.class);

    private final SolverConfig config;

    public Solver() { this(SolverConfig.defaults()); }

    public Solver(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SolverConfig config() { return config; }

    public Solution solve(Model model) {
        Objects.requireNonNull(model, "model");
        logger.info("Solving model with {} variables and {} constraints", model.numVariables(), model.numConstraints());

        if (!model.hasObjective() && isSquareEqualitySystem(model)) {
            Solution direct = solveLinearSystem(model);
            if (direct != null) return direct;
        }

        Solution solution = new BranchAndBound(config).solve(model);
        logger.info("Solve finished: {} {}", solution.status(),
                solution.objective().isPresent() ? "objective=" + solution.objective().getAsDouble() : "");
        return solution;
    }

    private static boolean isSquareEqualitySystem(Model model) {
        if (model.numConstraints() != model.numVariables() || model.numVariables() == 0) return false;
        for (Variable v : model.variables()) {
            if (v.isInteger() || v.lower() != Double.NEGATIVE_INFINITY || v.upper() != Double.POSITIVE_INFINITY) {
                return false;
            }
        }
        for (Constraint c : model.constraints()) if (c.relation() != Relation.EQUAL) return false;
        return true;
    }

    /** Unique solution of the square system, or null when it is singular. */
    private Solution solveLinearSystem(Model model) {
        final long t0 = System.nanoTime();
        int n = model.numVariables();
        double[][] A = new double[n][n];
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            Constraint c = model.constraints().get(i);
            LinearExpression e = c.expression();
            for (int k = 0; k < e.size(); k++) A[i][e.index(k)] = e.coefficient(k);
            b[i] = c.rhs();
        }
        double[] x;
        try {
            x = LinearSystemSolver.solve(A, b, config.numeric());
        } catch (ArithmeticException e) {
            logger.debug("Gaussian elimination failed ({}), falling back to simplex", e.getMessage());
            return null;
        }
        SolveStats stats = new SolveStats();
        stats.elapsed(Duration.ofNanos(System.nanoTime() - t0));
        logger.info("Solved square system by Gaussian elimination");
        return SolutionReporter.report(model, SolveStatus.OPTIMAL, x, 0.0, stats);
    }
}
