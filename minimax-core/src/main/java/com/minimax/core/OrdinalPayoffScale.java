package com.minimax.core;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Qualitative payoff scale backed by an enum, ordered by declaration order.
 *
 * <p>Negation is an explicit lookup rather than arithmetic. The mapping is validated when the
 * scale is built: it must be an involution and must reverse the declaration order.
 *
 * @param <E> the enum listing the payoffs from worst to best
 */
public final class OrdinalPayoffScale<E extends Enum<E>> implements NegatingPayoffScale<E> {

    private final Class<E> type;
    private final E[] values;
    private final EnumMap<E, E> negation;

    private OrdinalPayoffScale(Class<E> type, Map<E, E> negation) {
        this.type = type;
        this.values = type.getEnumConstants();
        if (values.length == 0) {
            throw new IllegalArgumentException("Payoff enum " + type.getSimpleName() + " declares no constants");
        }
        this.negation = new EnumMap<>(type);
        this.negation.putAll(negation);
        validate();
    }

    /**
     * Builds a scale whose negation mirrors the declaration order, mapping the first constant to
     * the last, the second to the second-to-last and so on.
     */
    public static <E extends Enum<E>> OrdinalPayoffScale<E> mirrored(Class<E> type) {
        Objects.requireNonNull(type, "type");
        E[] constants = type.getEnumConstants();
        Map<E, E> mirror = new EnumMap<>(type);
        for (int i = 0; i < constants.length; i++) {
            mirror.put(constants[i], constants[constants.length - 1 - i]);
        }
        return new OrdinalPayoffScale<>(type, mirror);
    }

    /**
     * Builds a scale using the provided negation table.
     *
     * @throws IllegalArgumentException if the table is incomplete, is not an involution, or does
     *         not reverse the order of the constants
     */
    public static <E extends Enum<E>> OrdinalPayoffScale<E> of(Class<E> type, Map<E, E> negation) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(negation, "negation");
        return new OrdinalPayoffScale<>(type, negation);
    }

    private void validate() {
        for (E value : values) {
            E negated = negation.get(value);
            if (negated == null) {
                throw new IllegalArgumentException("No negation defined for " + value);
            }
            if (negation.get(negated) != value) {
                throw new IllegalArgumentException("Negation is not an involution at " + value);
            }
        }
        for (int i = 1; i < values.length; i++) {
            E lower = values[i - 1];
            E upper = values[i];
            if (negation.get(lower).ordinal() <= negation.get(upper).ordinal()) {
                throw new IllegalArgumentException(
                        "Negation does not reverse the order of " + lower + " and " + upper);
            }
        }
    }

    public Class<E> type() {
        return type;
    }

    @Override
    public E min() {
        return values[0];
    }

    @Override
    public E max() {
        return values[values.length - 1];
    }

    @Override
    public E negate(E payoff) {
        return negation.get(Objects.requireNonNull(payoff, "payoff"));
    }

    @Override
    public int compare(E left, E right) {
        return Integer.compare(left.ordinal(), right.ordinal());
    }

    @Override
    public String toString() {
        return "OrdinalPayoffScale[" + type.getSimpleName() + "]";
    }
}
