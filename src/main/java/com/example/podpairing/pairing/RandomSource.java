package com.example.podpairing.pairing;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Source of every random decision taken while pairing: shuffles, 50/50 size picks,
 * weighted draws and room codes.
 */
public interface RandomSource {

    /** Uniform value in {@code [0, bound)}. */
    int nextInt(int bound);

    /** Uniform value in {@code [0, 1)}. */
    double nextDouble();

    default boolean nextBoolean() {
        return nextInt(2) == 0;
    }

    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            Collections.swap(list, i, nextInt(i + 1));
        }
    }

    /** Backed by a non-replayable {@link SecureRandom}; never seeded. */
    static RandomSource secure() {
        SecureRandom rnd = new SecureRandom();
        return new RandomSource() {
            @Override
            public int nextInt(int bound) {
                return rnd.nextInt(bound);
            }

            @Override
            public double nextDouble() {
                return rnd.nextDouble();
            }
        };
    }
}
