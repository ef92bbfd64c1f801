package ai.envlens.analyzer;

/** Outcome counters of a workspace scan. */
public record IndexingSummary(int attempted, int indexed, int failed, boolean cancelled) {

    public static final IndexingSummary NONE = new IndexingSummary(0, 0, 0, false);
}
