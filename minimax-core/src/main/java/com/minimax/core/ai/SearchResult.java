package com.minimax.core.ai;

import com.minimax.core.Action;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param action the selected action, {@code null} when the actor had none
 * @param payoff the payoff of the selected action for the searching actor, {@code null} when no
 *        child of the root could be scored
 * @param depthSearched the depth the root was expanded with
 * @param timedOut whether the time limit or stop signal interrupted the search
 * @param telemetry counters collected during the search
 * @param principalVariation actions along the best line, starting with {@code action}
 * @param rootAlternatives every root action whose subtree was scored, with its payoff for the
 *        searching actor; only filled by searchers that retain the full tree
 */
public record SearchResult<A extends Action, P>(
        A action,
        P payoff,
        int depthSearched,
        boolean timedOut,
        SearchTelemetry telemetry,
        List<A> principalVariation,
        List<Alternative<A, P>> rootAlternatives) {

    public SearchResult {
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        principalVariation = principalVariation == null ? List.of() : List.copyOf(principalVariation);
        rootAlternatives = rootAlternatives == null ? List.of() : List.copyOf(rootAlternatives);
    }

    /**
     * Result for a position in which the searching actor cannot act.
     */
    public static <A extends Action, P> SearchResult<A, P> noAction(int depthSearched, SearchTelemetry telemetry) {
        return new SearchResult<>(null, null, depthSearched, false, telemetry, List.of(), List.of());
    }

    public Optional<A> bestAction() {
        return Optional.ofNullable(action);
    }

    /**
     * Returns {@code true} if the selected action was backed by a scored subtree.
     */
    public boolean isDecided() {
        return payoff != null;
    }

    /**
     * A scored root action.
     *
     * @param action the root action
     * @param payoff its payoff for the searching actor; a bound rather than the exact value when
     *        pruning cut the subtree short
     */
    public record Alternative<A extends Action, P>(A action, P payoff) {

        public Alternative {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(payoff, "payoff");
        }
    }
}
