package org.pragmatica.rollkit.eval;

import org.junit.jupiter.api.Test;
import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangesTest {

    @Test
    void elements_ascendingWithStep() {
        assertEquals(List.of(1L, 3L, 5L, 7L, 9L), Ranges.elements(1, 10, 2, 100));
    }

    @Test
    void elements_stepSignIsIgnored() {
        assertEquals(Ranges.elements(1, 10, 2, 100), Ranges.elements(1, 10, -2, 100));
        assertEquals(List.of(10L, 7L, 4L, 1L), Ranges.elements(10, 1, 3, 100));
    }

    @Test
    void elements_descendingByDefault() {
        assertEquals(List.of(10L, 9L, 8L, 7L, 6L, 5L), Ranges.elements(10, 5, 1, 100));
    }

    @Test
    void elements_singleValue() {
        assertEquals(List.of(4L), Ranges.elements(4, 4, 7, 100));
    }

    @Test
    void elements_nearLongBounds_doNotWrap() {
        assertEquals(List.of(Long.MAX_VALUE - 2, Long.MAX_VALUE), Ranges.elements(Long.MAX_VALUE - 2, Long.MAX_VALUE, 2, 100));
        assertEquals(List.of(Long.MIN_VALUE + 1, Long.MIN_VALUE), Ranges.elements(Long.MIN_VALUE + 1, Long.MIN_VALUE, 1, 100));
        assertEquals(List.of(Long.MIN_VALUE, 0L), Ranges.elements(Long.MIN_VALUE, Long.MAX_VALUE, Long.MIN_VALUE, 100));
    }

    @Test
    void elements_zeroStep_fails() {
        var error = assertThrows(EvalException.class, () -> Ranges.elements(1, 10, 0, 100)).error();

        assertInstanceOf(EvalError.InvalidStep.class, error);
    }

    @Test
    void elements_overLimit_failsBeforeAllocating() {
        var error = assertThrows(EvalException.class, () -> Ranges.elements(1, 1_000, 1, 999)).error();
        assertEquals(new EvalError.ListTooLong(1_000, 999), error);

        var full = assertThrows(EvalException.class, () -> Ranges.elements(Long.MIN_VALUE, Long.MAX_VALUE, 1, 999)).error();
        assertEquals(new EvalError.ListTooLong(Long.MAX_VALUE, 999), full);
    }

    @Test
    void describeCount_handlesFullRange() {
        assertEquals("5", Ranges.describeCount(1, 10, 2));
        assertEquals("18446744073709551616", Ranges.describeCount(Long.MIN_VALUE, Long.MAX_VALUE, 1));
    }
}
