package com.minimax.core.ai;

import com.minimax.core.Action;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a node of a searched game tree.
 *
 * @param <S> the position type
 * @param <A> the action type
 * @param <P> the payoff type
 */
public interface GameTreeNode<S, A extends Action, P> {

    S state();

    /**
     * Returns the action that produced this node, or an empty result for the root.
     */
    Optional<A> cause();

    /**
     * Returns the payoff of this node, or {@code null} while it is undecided.
     */
    P payoff();

    /**
     * Returns the best continuation found below this node.
     */
    Optional<? extends GameTreeNode<S, A, P>> bestChild();

    default boolean hasPayoff() {
        return payoff() != null;
    }

    /**
     * Returns the actions along the best line below this node.
     */
    default List<A> principalVariation() {
        List<A> line = new ArrayList<>();
        Optional<? extends GameTreeNode<S, A, P>> next = bestChild();
        while (next.isPresent()) {
            GameTreeNode<S, A, P> node = next.get();
            node.cause().ifPresent(line::add);
            next = node.bestChild();
        }
        return line;
    }
}
