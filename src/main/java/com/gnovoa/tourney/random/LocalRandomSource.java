package com.gnovoa.tourney.random;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Unseeded source backed by {@link ThreadLocalRandom}; safe to share between jobs. */
public final class LocalRandomSource implements RandomSource {

    @Override public int nextIntInclusive(int fromInclusive, int toInclusive) {
        return ThreadLocalRandom.current().nextInt(fromInclusive, toInclusive + 1);
    }

    @Override public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }

    @Override public <T> void shuffle(List<T> list) {
        Collections.shuffle(list, ThreadLocalRandom.current());
    }
}
