package com.minimax.core.ai;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param depthLimit number of plies to look ahead; 0 is searched as 1
 * @param timeLimit wall-clock budget, {@link Duration#ZERO} for none
 * @param stopSignal polled once per visited node; the search stops when it returns {@code true}
 */
public record SearchConstraints(int depthLimit, Duration timeLimit, BooleanSupplier stopSignal) {

    private static final BooleanSupplier NEVER = () -> false;

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(stopSignal, "stopSignal");
        if (depthLimit < 0) {
            throw new IllegalArgumentException("depthLimit must not be negative");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    /**
     * Constraints limited only by depth.
     */
    public static SearchConstraints depth(int depthLimit) {
        return new SearchConstraints(depthLimit, Duration.ZERO, NEVER);
    }

    public SearchConstraints withTimeLimit(Duration limit) {
        return new SearchConstraints(depthLimit, limit, stopSignal);
    }

    public SearchConstraints withStopSignal(BooleanSupplier signal) {
        return new SearchConstraints(depthLimit, timeLimit, signal);
    }

    public boolean hasTimeLimit() {
        return !timeLimit.isZero();
    }
}
