package com.gnovoa.tourney.random;

import java.util.Random;

/** Reproducible source for seeded runs and tests. Not thread-safe; use one per optimization. */
public final class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override public int nextIntInclusive(int fromInclusive, int toInclusive) {
        return fromInclusive + random.nextInt(toInclusive - fromInclusive + 1);
    }

    @Override public double nextDouble() {
        return random.nextDouble();
    }
}
