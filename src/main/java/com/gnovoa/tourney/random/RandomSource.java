package com.gnovoa.tourney.random;

import java.util.List;

public interface RandomSource {
    int nextIntInclusive(int fromInclusive, int toInclusive);

    double nextDouble();

    /** Fisher-Yates shuffle in place. */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextIntInclusive(0, i);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }

    default <T> T pick(List<T> list) {
        if (list.isEmpty()) throw new IllegalArgumentException("Cannot pick from an empty list");
        return list.get(nextIntInclusive(0, list.size() - 1));
    }
}
