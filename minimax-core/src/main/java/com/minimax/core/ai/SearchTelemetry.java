package com.minimax.core.ai;

/**
 * Instrumentation data captured during a single {@link Searcher#search} call.
 *
 * @param visitedNodes nodes entered, the root included
 * @param evaluations static evaluations performed
 * @param cutoffs sibling enumerations stopped by an empty window
 * @param elapsedNanos wall-clock duration of the search
 */
public record SearchTelemetry(long visitedNodes, long evaluations, long cutoffs, long elapsedNanos) {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L);

    public SearchTelemetry {
        if (visitedNodes < 0L || evaluations < 0L || cutoffs < 0L || elapsedNanos < 0L) {
            throw new IllegalArgumentException("Telemetry counters must not be negative");
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
