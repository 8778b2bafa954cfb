package com.example.podpairing.pairing;

import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds pairing history from the full archive. Nothing is cached between generations.
 */
public final class PairingHistoryBuilder {

    /** Added on top of the base +1 per 3-seat placement when the extra penalty is on. */
    static final int EXTRA_UNDERSIZED_PENALTY = 3;

    private PairingHistoryBuilder() {}

    public static PairingHistory build(List<ArchivedRound> archive, boolean extraThreeSeatPenalty) {
        if (archive == null || archive.isEmpty()) return PairingHistory.empty();

        Map<PairKey, Integer> pairs = new HashMap<>();
        Map<String, Integer> undersized = new HashMap<>();
        Set<String> lastRoundUndersized = new HashSet<>();
        int increment = extraThreeSeatPenalty ? 1 + EXTRA_UNDERSIZED_PENALTY : 1;

        for (int r = 0; r < archive.size(); r++) {
            boolean latest = (r == archive.size() - 1);
            for (GameTable table : archive.get(r).getTables()) {
                if (table.isBye()) continue;

                List<String> ids = table.getParticipantIds();
                for (int i = 0; i < ids.size(); i++) {
                    for (int j = i + 1; j < ids.size(); j++) {
                        pairs.merge(PairKey.of(ids.get(i), ids.get(j)), 1, Integer::sum);
                    }
                }
                if (ids.size() == 3) {
                    for (String id : ids) {
                        undersized.merge(id, increment, Integer::sum);
                        if (latest) lastRoundUndersized.add(id);
                    }
                }
            }
        }
        return new PairingHistory(pairs, undersized, lastRoundUndersized);
    }
}
