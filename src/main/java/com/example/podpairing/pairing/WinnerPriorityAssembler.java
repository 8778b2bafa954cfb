package com.example.podpairing.pairing;

import com.example.podpairing.model.Participant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Re-seats the previous round's winners together.
 *
 * Full groups of four winners take empty 4-seat slots. A remainder of one to three winners borrows
 * non-winners through the selector to complete one more 4-seat slot, open custom slots first.
 * Winners that cannot be placed go back to the general pool.
 */
final class WinnerPriorityAssembler {

    private final RandomSource random;

    WinnerPriorityAssembler(RandomSource random) {
        this.random = random;
    }

    /**
     * @param winners  previous winners still in the pool
     * @param slots    slots of this round; seated winners are written into them
     * @param regulars non-winners; borrowed participants are removed from this list
     * @return winners left unplaced
     */
    List<Participant> assemble(List<Participant> winners, List<TableSlot> slots,
                               List<Participant> regulars, MinimalRepeatSelector selector) {
        List<Participant> pending = new ArrayList<>(winners);
        random.shuffle(pending);

        while (pending.size() >= 4) {
            TableSlot empty = slots.stream()
                    .filter(s -> s.targetSize() == 4 && !s.isCustom() && s.isEmpty())
                    .findFirst()
                    .orElse(null);
            if (empty == null) break;

            List<Participant> four = new ArrayList<>(pending.subList(0, 4));
            empty.seatAll(four);
            empty.markWinners();
            pending.subList(0, 4).clear();
        }

        if (pending.isEmpty() || pending.size() >= 4) return pending;

        int remainder = pending.size();
        List<TableSlot> targets = new ArrayList<>();
        for (TableSlot s : slots) {
            if (s.targetSize() == 4 && !s.hostsWinners() && s.free() >= remainder) targets.add(s);
        }
        targets.sort(Comparator.comparing((TableSlot s) -> !s.isCustom()).thenComparing(TableSlot::free));

        for (TableSlot slot : targets) {
            int needed = slot.free() - remainder;
            if (needed > regulars.size()) continue;

            slot.seatAll(pending);
            List<Participant> borrowed = selector.select(regulars, slot.members(), needed);
            slot.seatAll(borrowed);
            regulars.removeAll(borrowed);
            slot.markWinners();
            return List.of();
        }
        return pending;
    }
}
