package com.minimax.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchConstraintsTest {

    @Test
    void depthOnlyConstraintsHaveNoTimeLimit() {
        SearchConstraints constraints = SearchConstraints.depth(4);

        assertEquals(4, constraints.depthLimit());
        assertFalse(constraints.hasTimeLimit());
        assertFalse(constraints.stopSignal().getAsBoolean());
    }

    @Test
    void copiesKeepTheOtherSettings() {
        SearchConstraints constraints = SearchConstraints.depth(3)
                .withTimeLimit(Duration.ofMillis(20))
                .withStopSignal(() -> true);

        assertEquals(3, constraints.depthLimit());
        assertTrue(constraints.hasTimeLimit());
        assertEquals(Duration.ofMillis(20), constraints.timeLimit());
        assertTrue(constraints.stopSignal().getAsBoolean());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SearchConstraints.depth(-1));
        assertThrows(IllegalArgumentException.class,
                () -> SearchConstraints.depth(1).withTimeLimit(Duration.ofMillis(-5)));
        assertThrows(NullPointerException.class, () -> SearchConstraints.depth(1).withStopSignal(null));
    }
}
