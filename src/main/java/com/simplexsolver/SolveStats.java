package com.simplexsolver;

import java.time.Duration;

/** Work counters for one solve. */
public final class SolveStats {
    private long simplexIterations;
    private long nodesSolved;
    private long nodesPruned;
    private int maxDepth;
    private int incumbentUpdates;
    private Duration elapsed = Duration.ZERO;

    SolveStats() {}

    private SolveStats(SolveStats o) {
        this.simplexIterations = o.simplexIterations;
        this.nodesSolved = o.nodesSolved;
        this.nodesPruned = o.nodesPruned;
        this.maxDepth = o.maxDepth;
        this.incumbentUpdates = o.incumbentUpdates;
        this.elapsed = o.elapsed;
    }

    /** Pivots summed over every relaxation solved. */
    public long simplexIterations() { return simplexIterations; }
    /** Relaxations solved, root included. */
    public long nodesSolved() { return nodesSolved; }
    public long nodesPruned() { return nodesPruned; }
    public int maxDepth() { return maxDepth; }
    public int incumbentUpdates() { return incumbentUpdates; }
    public Duration elapsed() { return elapsed; }

    void addIterations(long k) { simplexIterations += k; }
    void nodeSolved(int depth) { nodesSolved++; maxDepth = Math.max(maxDepth, depth); }
    void nodePruned() { nodesPruned++; }
    void incumbentUpdated() { incumbentUpdates++; }
    void elapsed(Duration d) { this.elapsed = d; }

    SolveStats snapshot() { return new SolveStats(this); }

    @Override
    public String toString() {
        return "*Totals: iterations=" + simplexIterations +
                " nodes=" + nodesSolved +
                " pruned=" + nodesPruned +
                " max_depth=" + maxDepth +
                " incumbents=" + incumbentUpdates +
                String.format(" time=%.3fs", elapsed.toNanos() / 1e9);
    }
}
