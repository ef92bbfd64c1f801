package ai.envlens.analyzer.resolution;

import ai.envlens.analyzer.IEnvAnalyzer;

/** Hop counter shared by the local and cross-module halves of one resolution. */
public final class DepthBudget {
    private final int limit;
    private int hops;

    public DepthBudget(int limit) {
        this.limit = limit;
    }

    public static DepthBudget standard() {
        return new DepthBudget(IEnvAnalyzer.MAX_CHAIN_DEPTH);
    }

    /** Counts one followed link; false once more than {@code limit} links have been followed. */
    public boolean tryHop() {
        hops++;
        return hops <= limit;
    }

    /** Counts {@code count} links followed elsewhere, e.g. inside an exporting file. */
    public boolean trySpend(int count) {
        hops += count;
        return hops <= limit;
    }

    public int hops() {
        return hops;
    }

    public int limit() {
        return limit;
    }
}
