package com.example.podpairing.pairing;

import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.RoomSettings;
import com.example.podpairing.model.TableResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the tables of one round from the session's active participants and archive.
 *
 * Order of work: history, custom groups, size plan, slot targets, winner seeding, seat-by-seat
 * fill, validation, bye collection, relabel. The caller holds the session lock and is expected to
 * have archived the superseded round already.
 */
@Component
public class RoundGenerator {

    private static final Logger log = LoggerFactory.getLogger(RoundGenerator.class);

    private final RandomSource random;
    private final WinnerPriorityAssembler winnerAssembler;

    public RoundGenerator(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
        this.winnerAssembler = new WinnerPriorityAssembler(random);
    }

    /**
     * @param session     live session; participants' seat orders and dissolved groups are updated
     * @param roundNumber number stamped on every produced table
     * @param firstRound  winner seeding is skipped for the first round
     * @return numbered tables 1..n followed by the bye table (99) when anyone is left unseated
     */
    public List<GameTable> generate(RoomSession session, int roundNumber, boolean firstRound) {
        RoomSettings settings = session.getSettings();
        List<Participant> active = session.getActiveParticipants();

        PairingHistory history = PairingHistoryBuilder.build(session.getArchive(), settings.isExtraThreeSeatPenalty());
        MinimalRepeatSelector selector = new MinimalRepeatSelector(history, settings.getSelectorVariant(), random);

        // ---- custom groups ---------------------------------------------------
        List<GameTable> completeCustom = new ArrayList<>();
        List<CustomTableResolver.OpenGroup> openGroups = new ArrayList<>();
        List<Participant> available;
        if (settings.isAllowCustomGroups()) {
            CustomTableResolver.Resolution res = CustomTableResolver.resolve(active, roundNumber);
            completeCustom.addAll(res.completeTables());
            openGroups.addAll(res.openGroups());
            available = new ArrayList<>(res.available());
        } else {
            available = new ArrayList<>(active);
        }

        int openMembers = openGroups.stream().mapToInt(g -> g.members().size()).sum();
        TablePlan plan = TableSizePlanner.plan(available.size() + openMembers, settings.isAllowThreeSeatTables());
        if (!plan.isFeasible()) {
            plan = TableSizePlanner.plan(available.size() + openMembers, false);
        }

        // ---- slots -------------------------------------------------------------
        int fours = plan.fours();
        int threes = plan.threes();
        List<TableSlot> slots = new ArrayList<>();

        random.shuffle(openGroups);
        for (CustomTableResolver.OpenGroup g : openGroups) {
            int target;
            if (fours > 0 && threes > 0) target = random.nextBoolean() ? 4 : 3;
            else if (fours > 0) target = 4;
            else if (threes > 0) target = 3;
            else target = 0;

            if (target < g.members().size()) {
                // no table left for this group this round
                available.addAll(g.members());
                continue;
            }
            if (target == 4) fours--; else threes--;

            GameTable t = new GameTable(0, roundNumber);
            t.markCustom(g.groupId(), true);
            g.members().forEach(t::seat);
            slots.add(new TableSlot(t, target));
        }
        for (int i = 0; i < fours; i++) slots.add(new TableSlot(new GameTable(0, roundNumber), 4));
        for (int i = 0; i < threes; i++) slots.add(new TableSlot(new GameTable(0, roundNumber), 3));
        random.shuffle(slots);

        // ---- winners ------------------------------------------------------------
        List<Participant> pool = new ArrayList<>();
        if (!firstRound && settings.isPrioritizeWinners()) {
            Set<String> lastWinners = lastRoundWinners(session);
            List<Participant> winners = available.stream()
                    .filter(p -> lastWinners.contains(p.getId()))
                    .collect(Collectors.toList());
            available.removeAll(winners);
            if (!winners.isEmpty()) {
                pool.addAll(winnerAssembler.assemble(winners, slots, available, selector));
            }
        }
        pool.addAll(available);
        random.shuffle(pool);

        // ---- fill ----------------------------------------------------------------
        for (TableSlot slot : slots) {
            while (slot.free() > 0 && !pool.isEmpty()) {
                Participant p = selector.selectOne(pool, slot.members());
                slot.table().seat(p);
                pool.remove(p);
            }
        }
        for (TableSlot slot : slots) {
            if (slot.table().size() != slot.targetSize()) {
                throw new IllegalStateException("Algorithm bug: table filled to " + slot.table().size()
                        + " of " + slot.targetSize() + " seats in round " + roundNumber + " of room " + session.getCode());
            }
        }

        List<GameTable> tables = relabel(slots, completeCustom);

        if (!pool.isEmpty()) {
            GameTable bye = GameTable.bye(roundNumber);
            pool.forEach(p -> {
                p.setSeatOrder(0);
                bye.seat(p);
            });
            tables.add(bye);
        }

        log.info("Generated round {} for room {}: {} tables ({} custom, {} winner), {} on bye",
                roundNumber, session.getCode(), tables.size() - (pool.isEmpty() ? 0 : 1),
                tables.stream().filter(GameTable::isCustom).count(),
                slots.stream().filter(TableSlot::hostsWinners).count(),
                pool.size());
        return tables;
    }

    /**
     * Winner tables first, then regular, then custom; each class shuffled. Numbers run from 1 and
     * every table gets a shuffled seat order 1..n.
     */
    private List<GameTable> relabel(List<TableSlot> slots, List<GameTable> completeCustom) {
        List<GameTable> winners = new ArrayList<>();
        List<GameTable> regular = new ArrayList<>();
        List<GameTable> custom = new ArrayList<>(completeCustom);
        for (TableSlot s : slots) {
            if (s.hostsWinners()) winners.add(s.table());
            else if (s.isCustom()) custom.add(s.table());
            else regular.add(s.table());
        }
        random.shuffle(winners);
        random.shuffle(regular);
        random.shuffle(custom);

        List<GameTable> ordered = new ArrayList<>(winners);
        ordered.addAll(regular);
        ordered.addAll(custom);

        int number = 1;
        for (GameTable t : ordered) {
            t.setNumber(number++);
            List<Integer> seatOrders = new ArrayList<>();
            for (int i = 1; i <= t.size(); i++) seatOrders.add(i);
            random.shuffle(seatOrders);
            List<Participant> seated = t.getParticipants();
            for (int i = 0; i < seated.size(); i++) seated.get(i).setSeatOrder(seatOrders.get(i));
        }
        return ordered;
    }

    private static Set<String> lastRoundWinners(RoomSession session) {
        Set<String> ids = new HashSet<>();
        ArchivedRound last = session.latestArchivedRound().orElse(null);
        if (last == null) return ids;
        for (GameTable t : last.getTables()) {
            if (t.getResult() == TableResult.WIN && t.getWinnerId() != null) ids.add(t.getWinnerId());
        }
        return ids;
    }
}
