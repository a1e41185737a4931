package org.pragmatica.rollkit.function;

/**
 * Accepted argument count of a function, {@code min..max} inclusive.
 */
public record Arity(int min, int max) {
    public Arity {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid arity " + min + ".." + max);
        }
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity atLeast(int count) {
        return new Arity(count, Integer.MAX_VALUE);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        if (min == max) {
            return Integer.toString(min);
        }
        if (max == Integer.MAX_VALUE) {
            return "at least " + min;
        }
        return min + " to " + max;
    }
}
