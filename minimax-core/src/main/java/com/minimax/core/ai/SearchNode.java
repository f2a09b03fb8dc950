package com.minimax.core.ai;

import com.minimax.core.Action;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimax tree node that keeps a single child: the best continuation found so far.
 *
 * <p>Promoting a new child drops the previously retained subtree, so a finished search holds
 * exactly one line from the root to a leaf.
 */
public final class SearchNode<S, A extends Action, P> implements GameTreeNode<S, A, P> {

    private final S state;
    private final A cause;
    private P payoff;
    private SearchNode<S, A, P> retained;

    private SearchNode(S state, A cause) {
        this.state = Objects.requireNonNull(state, "state");
        this.cause = cause;
    }

    /**
     * Creates a root node referencing the caller's position as is.
     */
    public static <S, A extends Action, P> SearchNode<S, A, P> root(S state) {
        return new SearchNode<>(state, null);
    }

    public static <S, A extends Action, P> SearchNode<S, A, P> child(S state, A cause) {
        return new SearchNode<>(state, Objects.requireNonNull(cause, "cause"));
    }

    @Override
    public S state() {
        return state;
    }

    @Override
    public Optional<A> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public P payoff() {
        return payoff;
    }

    @Override
    public Optional<SearchNode<S, A, P>> bestChild() {
        return Optional.ofNullable(retained);
    }

    /**
     * Records the static evaluation of a leaf.
     */
    void score(P value) {
        if (payoff != null) {
            throw new IllegalStateException("Leaf payoff already set");
        }
        payoff = Objects.requireNonNull(value, "value");
    }

    /**
     * Replaces the retained child and adopts its payoff.
     */
    void promote(SearchNode<S, A, P> child, P childPayoff) {
        retained = Objects.requireNonNull(child, "child");
        payoff = Objects.requireNonNull(childPayoff, "childPayoff");
    }
}
