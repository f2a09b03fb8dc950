package com.minimax.core.ai;

import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.PayoffScale;
import java.util.Objects;
import java.util.Optional;

/**
 * Alpha-beta interval of payoffs that are still relevant to a search.
 *
 * <p>Narrowing never throws: a narrowing that would leave {@code lo > hi} returns an empty
 * result, which is the signal to stop exploring the remaining siblings.
 *
 * @param lo the lower bound (alpha)
 * @param hi the upper bound (beta)
 * @param <P> the payoff type
 */
public record Window<P>(P lo, P hi) {

    public Window {
        Objects.requireNonNull(lo, "lo");
        Objects.requireNonNull(hi, "hi");
    }

    /**
     * Creates a window without checking the bounds.
     */
    public static <P> Window<P> of(P lo, P hi) {
        return new Window<>(lo, hi);
    }

    /**
     * Creates a window if {@code lo <= hi} on the provided scale.
     */
    public static <P> Optional<Window<P>> tryOf(PayoffScale<P> scale, P lo, P hi) {
        if (scale.compare(lo, hi) > 0) {
            return Optional.empty();
        }
        return Optional.of(new Window<>(lo, hi));
    }

    /**
     * Returns the window spanning the whole scale.
     */
    public static <P> Window<P> full(PayoffScale<P> scale) {
        return new Window<>(scale.min(), scale.max());
    }

    public boolean isValid(PayoffScale<P> scale) {
        return scale.compare(lo, hi) <= 0;
    }

    /**
     * Raises the lower bound to {@code max(lo, value)}, as done after scoring a child of a
     * maximizing node.
     */
    public Optional<Window<P>> raiseLow(PayoffScale<P> scale, P value) {
        return tryOf(scale, scale.higher(lo, value), hi);
    }

    /**
     * Lowers the upper bound to {@code min(hi, value)}, as done after scoring a child of a
     * minimizing node.
     */
    public Optional<Window<P>> lowerHigh(PayoffScale<P> scale, P value) {
        return tryOf(scale, lo, scale.lower(hi, value));
    }

    /**
     * Returns the same window seen from the opponent's side: {@code (-hi, -lo)}.
     */
    public Window<P> negated(NegatingPayoffScale<P> scale) {
        return new Window<>(scale.negate(hi), scale.negate(lo));
    }
}
