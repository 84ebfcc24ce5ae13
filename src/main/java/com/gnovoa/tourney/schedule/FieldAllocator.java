package com.gnovoa.tourney.schedule;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.MatchGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Field assignment within a slot. Only regular matches compete for fields; locked ones keep theirs.
 */
final class FieldAllocator {

    private static final Logger log = LoggerFactory.getLogger(FieldAllocator.class);

    private FieldAllocator() {}

    static List<String> fieldPool(List<Match> matches) {
        Set<String> fields = new LinkedHashSet<>();
        for (Match m : matches) {
            if (m.isRegular() && !m.field().isBlank()) fields.add(m.field());
        }
        return List.copyOf(fields);
    }

    /** Gives every movable match a field drawn from a shuffled pool, slot by slot. */
    static void reassign(List<Match> matches, List<String> pool, RandomSource random) {
        if (pool.isEmpty()) return;
        MatchGroups.byTimeSlot(matches).forEach((slot, slotMatches) -> {
            Set<String> taken = new LinkedHashSet<>();
            List<Match> movable = new ArrayList<>();
            for (Match m : slotMatches) {
                if (!m.isRegular()) continue;
                if (m.locked()) taken.add(m.field());
                else movable.add(m);
            }
            List<String> free = new ArrayList<>(pool);
            free.removeAll(taken);
            random.shuffle(free);
            if (movable.size() > free.size()) {
                log.warn("Slot {} has {} matches for {} free fields; some fields will be shared",
                        slot, movable.size(), free.size());
            }
            for (int i = 0; i < movable.size(); i++) {
                String field = i < free.size() ? free.get(i) : pool.get(i % pool.size());
                movable.get(i).setField(field);
            }
        });
    }

    /** Keeps each match on its field unless already taken in the slot, then uses the first free one. */
    static void resolveConflicts(List<Match> matches, List<String> pool) {
        MatchGroups.byTimeSlot(matches).forEach((slot, slotMatches) -> {
            List<Match> regular = new ArrayList<>();
            for (Match m : slotMatches) if (m.isRegular() && m.locked()) regular.add(m);
            for (Match m : slotMatches) if (m.isRegular() && !m.locked()) regular.add(m);

            Set<String> used = new LinkedHashSet<>();
            for (Match m : regular) {
                if (used.add(m.field())) continue;
                if (m.locked()) continue;
                String free = pool.stream().filter(f -> !used.contains(f)).findFirst().orElse(null);
                if (free == null) {
                    log.warn("Slot {}: no free field for {}", slot, m);
                    continue;
                }
                log.debug("Slot {}: moving {} to {}", slot, m, free);
                m.setField(free);
                used.add(free);
            }
        });
    }
}
