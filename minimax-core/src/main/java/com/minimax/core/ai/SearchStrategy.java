package com.minimax.core.ai;

import com.minimax.core.Action;
import com.minimax.core.Actor;
import com.minimax.core.Evaluator;
import com.minimax.core.GameRule;
import com.minimax.core.Strategy;
import com.minimax.core.ZeroSumEvaluator;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Strategy} that picks actions by running a {@link Searcher} under fixed constraints.
 *
 * <p>Instances are immutable and may be reused for any number of positions.
 */
public final class SearchStrategy<S, A extends Action, P> implements Strategy<S, A> {

    private final Searcher<S, A, P> searcher;
    private final SearchConstraints constraints;

    public SearchStrategy(Searcher<S, A, P> searcher, SearchConstraints constraints) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    /**
     * Builds a strategy backed by {@link AlphaBetaSearcher}.
     */
    public static <S, A extends Action, P> SearchStrategy<S, A, P> minimax(GameRule<S, A> rule,
            Evaluator<S, P> evaluator, int searchDepth) {
        return new SearchStrategy<>(new AlphaBetaSearcher<>(rule, evaluator), SearchConstraints.depth(searchDepth));
    }

    /**
     * Builds a strategy backed by {@link NegamaxSearcher}.
     */
    public static <S, A extends Action, P> SearchStrategy<S, A, P> negamax(GameRule<S, A> rule,
            ZeroSumEvaluator<S, P> evaluator, int searchDepth) {
        return new SearchStrategy<>(new NegamaxSearcher<>(rule, evaluator), SearchConstraints.depth(searchDepth));
    }

    public SearchStrategy<S, A, P> withConstraints(SearchConstraints updated) {
        return new SearchStrategy<>(searcher, updated);
    }

    public SearchConstraints constraints() {
        return constraints;
    }

    @Override
    public Optional<A> selectAction(S state, Actor actor) {
        return search(state, actor).bestAction();
    }

    /**
     * Runs the full search and returns its detailed result.
     */
    public SearchResult<A, P> search(S state, Actor actor) {
        return searcher.search(state, actor, constraints);
    }
}
