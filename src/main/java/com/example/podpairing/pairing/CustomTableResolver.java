package com.example.podpairing.pairing;

import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Carves host/player curated custom groups out of the pool before regular seating.
 *
 * A group is complete when it has 4 members or auto-fill is off, and is emitted as a custom table
 * as-is. Other groups are open: their remaining seats are filled by the selector. A group reduced to a
 * single member is dissolved.
 */
final class CustomTableResolver {

    private CustomTableResolver() {}

    record OpenGroup(String groupId, List<Participant> members) {}

    record Resolution(List<GameTable> completeTables, List<OpenGroup> openGroups, List<Participant> available) {}

    static Resolution resolve(List<Participant> active, int roundNumber) {
        Map<String, List<Participant>> groups = new LinkedHashMap<>();
        List<Participant> available = new ArrayList<>();

        for (Participant p : active) {
            if (p.isInCustomGroup()) {
                groups.computeIfAbsent(p.getCustomGroupId(), k -> new ArrayList<>()).add(p);
            } else {
                available.add(p);
            }
        }

        List<GameTable> complete = new ArrayList<>();
        List<OpenGroup> open = new ArrayList<>();

        for (Map.Entry<String, List<Participant>> e : groups.entrySet()) {
            List<Participant> members = e.getValue();
            if (members.size() == 1) {
                Participant lone = members.get(0);
                lone.leaveCustomGroup();
                available.add(lone);
                continue;
            }

            boolean autoFill = members.stream().anyMatch(Participant::isAutoFill);
            boolean fillsTable = members.size() >= TableSizePlanner.MAX_TABLE_SIZE || !autoFill;
            if (fillsTable) {
                GameTable t = new GameTable(0, roundNumber);
                t.markCustom(e.getKey(), autoFill);
                members.forEach(t::seat);
                complete.add(t);
            } else {
                open.add(new OpenGroup(e.getKey(), members));
            }
        }
        return new Resolution(complete, open, available);
    }
}
