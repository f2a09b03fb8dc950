package com.minimax.core.ai.state;

import com.minimax.core.ai.SearchConstraints;
import com.minimax.core.ai.SearchTelemetry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Mutable bookkeeping of a single search call: node counters and the cancellation checks.
 *
 * <p>A new instance is created for every search, so searchers themselves stay stateless.
 */
public final class SearchState {

    private final long startNanos;
    private final long deadline;
    private final BooleanSupplier stopSignal;

    private long visitedNodes;
    private long evaluations;
    private long cutoffs;
    private boolean aborted;

    private SearchState(long startNanos, long deadline, BooleanSupplier stopSignal) {
        this.startNanos = startNanos;
        this.deadline = deadline;
        this.stopSignal = stopSignal;
    }

    /**
     * Starts the clock for a search bound by the provided constraints.
     */
    public static SearchState start(SearchConstraints constraints) {
        Objects.requireNonNull(constraints, "constraints");
        long now = System.nanoTime();
        long deadline = constraints.hasTimeLimit()
                ? saturatingAdd(now, toTimeLimitNanos(constraints.timeLimit()))
                : Long.MAX_VALUE;
        return new SearchState(now, deadline, constraints.stopSignal());
    }

    /**
     * Accounts for a node visit and aborts the search if it must stop.
     *
     * @throws SearchAbortedException when the deadline has passed or a stop was requested
     */
    public void visit() {
        if (isDeadlineExceeded()) {
            aborted = true;
            throw new SearchAbortedException("Search interrupted after " + visitedNodes + " nodes");
        }
        visitedNodes++;
    }

    public void recordEvaluation() {
        evaluations++;
    }

    public void recordCutoff() {
        cutoffs++;
    }

    public long visitedNodes() {
        return visitedNodes;
    }

    public boolean isAborted() {
        return aborted;
    }

    public SearchTelemetry telemetry() {
        return new SearchTelemetry(visitedNodes, evaluations, cutoffs, Math.max(0L, System.nanoTime() - startNanos));
    }

    private boolean isDeadlineExceeded() {
        return aborted
                || stopSignal.getAsBoolean()
                || (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline);
    }

    private static long toTimeLimitNanos(Duration timeLimit) {
        long nanos;
        try {
            nanos = timeLimit.toNanos();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
        return nanos <= 0L ? 1L : nanos;
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
