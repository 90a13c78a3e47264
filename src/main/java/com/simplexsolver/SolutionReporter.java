package com.simplexsolver;

/**
 * Builds the immutable {@link Solution} from a search outcome, mapping the internal
 * minimisation objective back to the model's sense and adding its constant.
 */
final class SolutionReporter {

    private SolutionReporter() {}

    /**
     * @param values            best assignment, or null when none was found
     * @param internalObjective objective of {@code values} in minimisation form
     */
    static Solution report(Model model, SolveStatus status, double[] values, double internalObjective,
                           SolveStats stats) {
        if (status == SolveStatus.OPTIMAL && values == null) {
            throw new IllegalArgumentException("an optimal solution needs an assignment");
        }
        if (values != null && (status == SolveStatus.INFEASIBLE || status == SolveStatus.UNBOUNDED)) {
            values = null;
        }
        double objective = Double.NaN;
        if (values != null && model.hasObjective()) {
            Objective obj = model.objective().get();
            objective = obj.sense().sign() * internalObjective + obj.constant();
            if (objective == 0.0) objective = 0.0;   // no -0.0 from negated maximisation
        }
        return new Solution(status, values, objective, stats.snapshot());
    }

    static Solution report(Model model, SolveStatus status, SolveStats stats) {
        return report(model, status, null, Double.NaN, stats);
    }
}
