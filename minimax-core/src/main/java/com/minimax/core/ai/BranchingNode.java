package com.minimax.core.ai;

import com.minimax.core.Action;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Negamax tree node that keeps every explored child.
 *
 * <p>The payoff of a node is expressed from the point of view of the actor to move in it. The
 * full tree lets callers inspect runner-up lines at the cost of memory growing with the
 * branching factor.
 */
public final class BranchingNode<S, A extends Action, P> implements GameTreeNode<S, A, P> {

    private final S state;
    private final A cause;
    private final List<BranchingNode<S, A, P>> children = new ArrayList<>();
    private P payoff;
    private BranchingNode<S, A, P> best;

    private BranchingNode(S state, A cause) {
        this.state = Objects.requireNonNull(state, "state");
        this.cause = cause;
    }

    public static <S, A extends Action, P> BranchingNode<S, A, P> root(S state) {
        return new BranchingNode<>(state, null);
    }

    public static <S, A extends Action, P> BranchingNode<S, A, P> child(S state, A cause) {
        return new BranchingNode<>(state, Objects.requireNonNull(cause, "cause"));
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
    public Optional<BranchingNode<S, A, P>> bestChild() {
        return Optional.ofNullable(best);
    }

    /**
     * Returns the explored children in exploration order. Children cut off by pruning are absent.
     */
    public List<BranchingNode<S, A, P>> children() {
        return Collections.unmodifiableList(children);
    }

    void score(P value) {
        if (payoff != null) {
            throw new IllegalStateException("Leaf payoff already set");
        }
        payoff = Objects.requireNonNull(value, "value");
    }

    void addChild(BranchingNode<S, A, P> child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    /**
     * Marks an already attached child as the best one and sets this node's payoff, which is the
     * child's payoff negated.
     */
    void promote(BranchingNode<S, A, P> child, P value) {
        if (!children.contains(child)) {
            throw new IllegalStateException("Cannot promote a node that is not a child");
        }
        best = child;
        payoff = Objects.requireNonNull(value, "value");
    }
}
