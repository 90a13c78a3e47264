package com.simplexsolver;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first branch-and-bound over LP relaxations.
 *
 * <p>Each node's relaxation is the model with the node's tightened bounds, solved on a
 * fresh tableau. An integral relaxation becomes the incumbent when strictly better; a
 * fractional one branches on its most fractional integer variable, the down child
 * ({@code x <= floor(v)}) being explored before the up child ({@code x >= ceil(v)}).
 * Nodes whose bound cannot beat the incumbent are pruned.
 */
final class BranchAndBound {
    private static final Logger logger = LoggerFactory.getLogger(BranchAndBound.class);

    private final SolverConfig config;
    private final Tolerance tol;
    private final SimplexSolver simplex;

    BranchAndBound(SolverConfig config) {
        this.config = config;
        this.tol = config.numeric();
        this.simplex = new SimplexSolver(config);
    }

    /** Result of one search; {@link #tree} keeps every node for inspection. */
    static final class Search {
        final SolveStatus status;
        final Incumbent incumbent;
        final List<BranchNode> tree;
        final SolveStats stats;

        private Search(SolveStatus status, Incumbent incumbent, List<BranchNode> tree, SolveStats stats) {
            this.status = status;
            this.incumbent = incumbent;
            this.tree = Collections.unmodifiableList(tree);
            this.stats = stats;
        }
    }

    Solution solve(Model model) {
        Search s = search(model);
        return SolutionReporter.report(model, s.status, s.incumbent.values(), s.incumbent.objective(), s.stats);
    }

    Search search(Model model) {
        final long t0 = System.nanoTime();
        final long deadline = config.timeLimit == null ? Long.MAX_VALUE : t0 + config.timeLimit.toNanos();

        Incumbent incumbent = new Incumbent(tol);
        SolveStats stats = new SolveStats();
        List<BranchNode> arena = new ArrayList<>();
        Deque<Integer> frontier = new ArrayDeque<>();

        arena.add(BranchNode.root(model.lowerBounds(), model.upperBounds()));
        frontier.push(0);

        SolveStatus stopped = null;
        while (!frontier.isEmpty()) {
            if (stats.nodesSolved() >= config.nodeLimit) {
                logger.warn("node limit {} reached with {} open nodes", config.nodeLimit, frontier.size());
                stopped = SolveStatus.NODE_LIMIT_EXCEEDED;
                break;
            }
            if (System.nanoTime() > deadline) {
                logger.warn("time limit {} reached with {} open nodes", config.timeLimit, frontier.size());
                stopped = SolveStatus.TIME_LIMIT_EXCEEDED;
                break;
            }

            BranchNode node = arena.get(frontier.pop());
            if (!incumbent.canImprove(node.parentBound)) {
                prune(node, stats);
                continue;
            }

            LpResult lp = simplex.solve(model.withBounds(node.lower(), node.upper()));
            stats.nodeSolved(node.depth);
            stats.addIterations(lp.iterations);
            logger.debug("{}: {}", node, lp);

            if (lp.status == SolveStatus.INFEASIBLE) {
                node.solved(BranchNode.State.INFEASIBLE, Double.NaN);
                node.resolve(BranchNode.State.INFEASIBLE);
                continue;
            }
            if (lp.status == SolveStatus.UNBOUNDED) {
                // A child region is contained in the root's, so this only happens at the root
                // or through numeric trouble; either way no finite optimum is proven.
                node.solved(BranchNode.State.UNBOUNDED, Double.NEGATIVE_INFINITY);
                node.resolve(BranchNode.State.UNBOUNDED);
                stopped = SolveStatus.UNBOUNDED;
                break;
            }
            if (lp.status == SolveStatus.ITERATION_LIMIT_EXCEEDED) {
                stopped = SolveStatus.ITERATION_LIMIT_EXCEEDED;
                break;
            }

            int j = selectBranchVariable(model, lp.values);
            node.solved(j < 0 ? BranchNode.State.INTEGRAL : BranchNode.State.FRACTIONAL, lp.objective);

            if (!incumbent.canImprove(lp.objective)) {
                prune(node, stats);
                continue;
            }

            if (j < 0) {
                incumbent.offer(roundIntegers(model, lp.values), lp.objective);
                stats.incumbentUpdated();
                logger.debug("new incumbent z={} at depth {}", lp.objective, node.depth);
                node.resolve(BranchNode.State.ACCEPTED);
                continue;
            }

            double v = lp.values[j];
            BranchNode down = node.child(arena.size(), j, BranchNode.Direction.DOWN, Math.floor(v));
            arena.add(down);
            BranchNode up = node.child(arena.size(), j, BranchNode.Direction.UP, Math.ceil(v));
            arena.add(up);
            node.resolve(BranchNode.State.BRANCHED);

            // LIFO: push up first so down is explored first
            enqueue(up, frontier);
            enqueue(down, frontier);
        }

        SolveStatus status;
        if (stopped != null) status = stopped;
        else status = incumbent.isPresent() ? SolveStatus.OPTIMAL : SolveStatus.INFEASIBLE;

        stats.elapsed(Duration.ofNanos(System.nanoTime() - t0));
        logger.info("branch-and-bound {}: {}", status, stats);
        return new Search(status, incumbent, arena, stats);
    }

    private static void enqueue(BranchNode child, Deque<Integer> frontier) {
        if (child.hasCrossedBounds()) {
            child.solved(BranchNode.State.INFEASIBLE, Double.NaN);
            child.resolve(BranchNode.State.INFEASIBLE);
            return;
        }
        frontier.push(child.id);
    }

    private static void prune(BranchNode node, SolveStats stats) {
        node.resolve(BranchNode.State.PRUNED);
        stats.nodePruned();
    }

    /**
     * Integer variable whose value is farthest from integral (closest to a half-integer);
     * ties within tolerance go to the lowest index. -1 when every integer variable is
     * integral within tolerance.
     */
    int selectBranchVariable(Model model, double[] values) {
        int best = -1;
        double bestFrac = 0.0;
        for (Variable var : model.variables()) {
            if (!var.isInteger()) continue;
            double x = values[var.index()];
            if (tol.isIntegral(x)) continue;
            double frac = Tolerance.fractionality(x);
            if (best == -1 || frac > bestFrac + tol.epsilon()) {
                best = var.index();
                bestFrac = frac;
            }
        }
        return best;
    }

    private static double[] roundIntegers(Model model, double[] values) {
        double[] out = values.clone();
        for (Variable var : model.variables()) {
            if (var.isInteger()) out[var.index()] = Math.rint(out[var.index()]) + 0.0;
        }
        return out;
    }
}
