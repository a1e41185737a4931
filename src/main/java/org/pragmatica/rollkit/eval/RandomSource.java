package org.pragmatica.rollkit.eval;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Source of uniformly distributed integers consumed by dice rolls.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Next integer drawn uniformly from {@code lo..hi}, both inclusive. Callers guarantee {@code lo <= hi}.
     */
    long nextLong(long lo, long hi);

    /**
     * Reproducible source: two sources with the same seed produce the same sequence.
     */
    static RandomSource seeded(long seed) {
        return from(new SplittableRandom(seed));
    }

    /**
     * Fresh, unseeded source.
     */
    static RandomSource system() {
        return from(new SplittableRandom());
    }

    static RandomSource from(RandomGenerator generator) {
        return (lo, hi) -> {
            if (hi < Long.MAX_VALUE) {
                return generator.nextLong(lo, hi + 1);
            }
            if (lo > Long.MIN_VALUE) {
                return generator.nextLong(lo - 1, hi) + 1;
            }
            return generator.nextLong();
        };
    }
}
