package com.minimax.core;

/**
 * Integer payoffs on the symmetric range {@code [-Integer.MAX_VALUE, Integer.MAX_VALUE]}.
 *
 * <p>{@link Integer#MIN_VALUE} is deliberately outside the scale since it has no negation;
 * negating it raises {@link ArithmeticException}.
 */
public final class IntPayoffScale implements NegatingPayoffScale<Integer> {

    public static final int MIN_PAYOFF = -Integer.MAX_VALUE;
    public static final int MAX_PAYOFF = Integer.MAX_VALUE;

    private static final IntPayoffScale INSTANCE = new IntPayoffScale();

    private IntPayoffScale() {
    }

    public static IntPayoffScale instance() {
        return INSTANCE;
    }

    @Override
    public Integer min() {
        return MIN_PAYOFF;
    }

    @Override
    public Integer max() {
        return MAX_PAYOFF;
    }

    @Override
    public Integer negate(Integer payoff) {
        return Math.negateExact(payoff);
    }

    @Override
    public int compare(Integer left, Integer right) {
        return Integer.compare(left, right);
    }

    @Override
    public String toString() {
        return "IntPayoffScale";
    }
}
