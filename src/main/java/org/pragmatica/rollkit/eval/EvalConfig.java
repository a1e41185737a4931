package org.pragmatica.rollkit.eval;

/**
 * Evaluator configuration options.
 *
 * @param maxListLength largest list a dice roll or range may produce
 */
public record EvalConfig(int maxListLength) {
    public static final EvalConfig DEFAULT = new EvalConfig(10_000_000);

    public EvalConfig {
        if (maxListLength < 1) {
            throw new IllegalArgumentException("maxListLength must be positive, got " + maxListLength);
        }
    }

    public EvalConfig withMaxListLength(int newMaxListLength) {
        return new EvalConfig(newMaxListLength);
    }
}
