package org.pragmatica.rollkit.eval;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive arithmetic sequences for range literals. Only the magnitude of the step matters; the direction
 * follows the bounds.
 */
public final class Ranges {
    private Ranges() {}

    /**
     * Number of elements in the range, as an unsigned value (a full-width range has 2^64 elements, which wraps
     * to zero).
     */
    public static long count(long start, long end, long step) {
        if (step == 0) {
            throw new EvalException(new EvalError.InvalidStep());
        }
        // both values are exact when read as unsigned, including abs(Long.MIN_VALUE)
        long distance = start <= end ? end - start : start - end;
        long magnitude = Math.abs(step);
        return Long.divideUnsigned(distance, magnitude) + 1;
    }

    public static List<Long> elements(long start, long end, long step, int limit) {
        long count = count(start, end, step);
        if (count == 0 || Long.compareUnsigned(count, limit) > 0) {
            long requested = count > 0 ? count : Long.MAX_VALUE;
            throw new EvalException(new EvalError.ListTooLong(requested, limit));
        }

        long magnitude = Math.abs(step);
        var result = new ArrayList<Long>((int) count);
        for (long i = 0; i < count; i++) {
            result.add(start <= end ? start + i * magnitude : start - i * magnitude);
        }
        return result;
    }

    /**
     * Unsigned element count rendered for display.
     */
    public static String describeCount(long start, long end, long step) {
        var count = count(start, end, step);
        return count == 0 ? "18446744073709551616" : Long.toUnsignedString(count);
    }
}
