package org.pragmatica.rollkit.eval;

import java.util.ArrayList;
import java.util.List;

/**
 * Random source that replays fixed draws and records the bounds it was asked for.
 */
final class ScriptedRandom implements RandomSource {
    private final long[] draws;
    private final List<long[]> requests = new ArrayList<>();
    private int next;

    private ScriptedRandom(long[] draws) {
        this.draws = draws;
    }

    static ScriptedRandom of(long... draws) {
        return new ScriptedRandom(draws);
    }

    @Override
    public long nextLong(long lo, long hi) {
        if (next >= draws.length) {
            throw new IllegalStateException("No scripted draw left");
        }
        var draw = draws[next++];
        if (draw < lo || draw > hi) {
            throw new IllegalStateException("Scripted draw " + draw + " outside " + lo + ".." + hi);
        }
        requests.add(new long[]{lo, hi});
        return draw;
    }

    int used() {
        return next;
    }

    List<long[]> requests() {
        return requests;
    }
}
