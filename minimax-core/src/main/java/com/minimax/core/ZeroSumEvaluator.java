package com.minimax.core;

/**
 * Evaluator of a zero-sum game: for every reachable position {@code p} and actor {@code a},
 * {@code scoreFor(a.opponent(), p)} equals {@code scale().negate(scoreFor(a, p))}.
 *
 * <p>The law is not checked during a search. An evaluator that breaks it makes
 * {@link com.minimax.core.ai.NegamaxSearcher} choose wrong moves without failing;
 * {@link com.minimax.core.ai.NegationLaw} can be used to verify an implementation.
 *
 * @param <S> the position type
 * @param <P> the payoff type
 */
public interface ZeroSumEvaluator<S, P> extends Evaluator<S, P> {

    @Override
    NegatingPayoffScale<P> scale();
}
