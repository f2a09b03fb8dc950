package com.minimax.core.ai;

import com.minimax.core.Action;
import com.minimax.core.Actor;
import com.minimax.core.Evaluator;
import com.minimax.core.GameRule;
import com.minimax.core.ZeroSumEvaluator;
import java.util.Optional;

/**
 * One-call entry points for selecting an action.
 */
public final class Strategies {

    private Strategies() {
    }

    /**
     * Selects the best action of {@code actor} with minimax and alpha-beta pruning.
     *
     * @return the selected action, empty if and only if the actor has no legal action
     * @throws IllegalArgumentException if {@code searchDepth} is negative
     */
    public static <S, A extends Action, P> Optional<A> selectAction(GameRule<S, A> rule, Evaluator<S, P> evaluator,
            S state, Actor actor, int searchDepth) {
        return SearchStrategy.minimax(rule, evaluator, searchDepth).selectAction(state, actor);
    }

    /**
     * Selects the best action of {@code actor} with negamax. The evaluator must obey the zero-sum
     * law described on {@link ZeroSumEvaluator}.
     */
    public static <S, A extends Action, P> Optional<A> selectActionNegamax(GameRule<S, A> rule,
            ZeroSumEvaluator<S, P> evaluator, S state, Actor actor, int searchDepth) {
        return SearchStrategy.negamax(rule, evaluator, searchDepth).selectAction(state, actor);
    }
}
