package com.example.podpairing.pairing;

import java.util.Objects;

/** Unordered pair of participant ids; {@code of(a, b).equals(of(b, a))}. */
public record PairKey(String first, String second) {

    public PairKey {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("PairKey components must be ordered; use PairKey.of");
        }
    }

    public static PairKey of(String a, String b) {
        return (a.compareTo(b) <= 0) ? new PairKey(a, b) : new PairKey(b, a);
    }

    @Override
    public String toString() {
        return first + "|" + second;
    }
}
