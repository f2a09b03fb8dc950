package com.minimax.core.ai;

import com.minimax.core.Actor;
import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.ZeroSumEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that a {@link ZeroSumEvaluator} obeys the zero-sum law on sample positions.
 */
public final class NegationLaw {

    private NegationLaw() {
    }

    /**
     * Returns every sampled position and actor for which
     * {@code scoreFor(actor.opponent(), p) != negate(scoreFor(actor, p))} or for which negating
     * the payoff twice does not give it back.
     */
    public static <S, P> List<Violation<S, P>> violations(ZeroSumEvaluator<S, P> evaluator, Iterable<S> positions) {
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(positions, "positions");
        NegatingPayoffScale<P> scale = evaluator.scale();
        List<Violation<S, P>> found = new ArrayList<>();
        for (S position : positions) {
            for (Actor actor : Actor.values()) {
                P own = evaluator.scoreFor(actor, position);
                P opposing = evaluator.scoreFor(actor.opponent(), position);
                boolean zeroSum = scale.compare(opposing, scale.negate(own)) == 0;
                boolean involutive = scale.compare(scale.negate(scale.negate(own)), own) == 0;
                if (!zeroSum || !involutive) {
                    found.add(new Violation<>(position, actor, own, opposing));
                }
            }
        }
        return found;
    }

    /**
     * @throws IllegalArgumentException describing the first violation, if any
     */
    public static <S, P> void requireHolds(ZeroSumEvaluator<S, P> evaluator, Iterable<S> positions) {
        List<Violation<S, P>> found = violations(evaluator, positions);
        if (!found.isEmpty()) {
            throw new IllegalArgumentException(
                    "Evaluator breaks the zero-sum law in " + found.size() + " case(s), first: " + found.get(0));
        }
    }

    /**
     * A position where the evaluator is not zero-sum.
     */
    public record Violation<S, P>(S position, Actor actor, P payoff, P opponentPayoff) {
    }
}
