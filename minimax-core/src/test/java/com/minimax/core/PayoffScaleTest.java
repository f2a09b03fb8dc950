package com.minimax.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayoffScaleTest {

    private enum Outcome {
        LOSS,
        BEHIND,
        EVEN,
        AHEAD,
        WIN
    }

    @Test
    void intScaleIsSymmetric() {
        IntPayoffScale scale = IntPayoffScale.instance();

        assertEquals(scale.max(), scale.negate(scale.min()));
        assertEquals(scale.min(), scale.negate(scale.max()));
        assertEquals(-17, scale.negate(17));
        assertEquals(17, scale.negate(scale.negate(17)));
    }

    @Test
    void intScaleRefusesToNegateOutsideItsRange() {
        assertThrows(ArithmeticException.class, () -> IntPayoffScale.instance().negate(Integer.MIN_VALUE));
    }

    @Test
    void comparisonHelpersAreStrict() {
        IntPayoffScale scale = IntPayoffScale.instance();

        assertTrue(scale.isBetter(3, 2));
        assertFalse(scale.isBetter(2, 2));
        assertTrue(scale.isWorse(1, 2));
        assertFalse(scale.isWorse(2, 2));
        assertEquals(5, scale.higher(5, -1));
        assertEquals(-1, scale.lower(5, -1));
    }

    @Test
    void mirroredOrdinalScaleReversesOrder() {
        OrdinalPayoffScale<Outcome> scale = OrdinalPayoffScale.mirrored(Outcome.class);

        assertEquals(Outcome.LOSS, scale.min());
        assertEquals(Outcome.WIN, scale.max());
        for (Outcome outcome : Outcome.values()) {
            assertEquals(outcome, scale.negate(scale.negate(outcome)));
            for (Outcome other : Outcome.values()) {
                assertEquals(Integer.signum(scale.compare(outcome, other)),
                        -Integer.signum(scale.compare(scale.negate(outcome), scale.negate(other))));
            }
        }
        assertEquals(Outcome.EVEN, scale.negate(Outcome.EVEN));
        assertEquals(Outcome.BEHIND, scale.negate(Outcome.AHEAD));
    }

    @Test
    void ordinalScaleRejectsNonInvolution() {
        Map<Outcome, Outcome> negation = new EnumMap<>(Outcome.class);
        negation.put(Outcome.LOSS, Outcome.WIN);
        negation.put(Outcome.BEHIND, Outcome.AHEAD);
        negation.put(Outcome.EVEN, Outcome.EVEN);
        negation.put(Outcome.AHEAD, Outcome.EVEN);
        negation.put(Outcome.WIN, Outcome.LOSS);

        assertThrows(IllegalArgumentException.class, () -> OrdinalPayoffScale.of(Outcome.class, negation));
    }

    @Test
    void ordinalScaleRejectsOrderPreservingMap() {
        Map<Outcome, Outcome> identity = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            identity.put(outcome, outcome);
        }

        assertThrows(IllegalArgumentException.class, () -> OrdinalPayoffScale.of(Outcome.class, identity));
    }

    @Test
    void ordinalScaleRejectsIncompleteMap() {
        Map<Outcome, Outcome> partial = new EnumMap<>(Outcome.class);
        partial.put(Outcome.LOSS, Outcome.WIN);
        partial.put(Outcome.WIN, Outcome.LOSS);

        assertThrows(IllegalArgumentException.class, () -> OrdinalPayoffScale.of(Outcome.class, partial));
    }
}
