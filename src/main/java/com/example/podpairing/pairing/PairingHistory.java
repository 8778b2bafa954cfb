package com.example.podpairing.pairing;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of past seating, derived from the archive by {@link PairingHistoryBuilder}.
 */
public final class PairingHistory {

    private static final PairingHistory EMPTY = new PairingHistory(Map.of(), Map.of(), Set.of());

    private final Map<PairKey, Integer> pairCounts;
    private final Map<String, Integer> undersizedCounts;
    private final Set<String> undersizedLastRound;

    PairingHistory(Map<PairKey, Integer> pairCounts,
                   Map<String, Integer> undersizedCounts,
                   Set<String> undersizedLastRound) {
        this.pairCounts = Collections.unmodifiableMap(pairCounts);
        this.undersizedCounts = Collections.unmodifiableMap(undersizedCounts);
        this.undersizedLastRound = Collections.unmodifiableSet(undersizedLastRound);
    }

    public static PairingHistory empty() {
        return EMPTY;
    }

    /** How often the two participants shared a table. Symmetric; 0 for a participant with itself. */
    public int pairCount(String a, String b) {
        if (a == null || b == null || a.equals(b)) return 0;
        return pairCounts.getOrDefault(PairKey.of(a, b), 0);
    }

    /** Weighted count of past 3-seat placements. */
    public int undersizedCount(String participantId) {
        return undersizedCounts.getOrDefault(participantId, 0);
    }

    public boolean wasUndersizedLastRound(String participantId) {
        return undersizedLastRound.contains(participantId);
    }

    public Map<PairKey, Integer> pairCounts() {
        return pairCounts;
    }

    public Map<String, Integer> undersizedCounts() {
        return undersizedCounts;
    }
}
