package com.gnovoa.tourney.schedule;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.random.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Produces a perturbed copy of a schedule. Special activities and locked matches stay where they are;
 * every other regular match may get a new slot, field and referee.
 *
 * <ul>
 *   <li>block shuffle (25%): divisions take turns, in random order, over the sorted slot multiset</li>
 *   <li>within-division shuffle (50%): each division permutes its own slot multiset</li>
 *   <li>scatter (25%): matches spread over the existing regular slots, bounded by the field count</li>
 * </ul>
 */
public final class ScheduleRandomizer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRandomizer.class);

    enum Mode { BLOCK_SHUFFLE, WITHIN_DIVISION, SCATTER }

    private final RandomSource random;
    private final RefereeAssigner referees;

    public ScheduleRandomizer(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
        this.referees = new RefereeAssigner(random);
    }

    public Schedule randomize(Schedule source) {
        double roll = random.nextDouble();
        Mode mode = roll < 0.25 ? Mode.BLOCK_SHUFFLE : roll < 0.75 ? Mode.WITHIN_DIVISION : Mode.SCATTER;
        return randomize(source, mode);
    }

    Schedule randomize(Schedule source, Mode mode) {
        Schedule copy = source.copyMatches();
        List<Match> all = copy.mutableMatches();
        List<String> pool = FieldAllocator.fieldPool(all);
        List<Match> movable = all.stream().filter(Match::isMovable).toList();
        if (movable.isEmpty()) return copy;

        switch (mode) {
            case BLOCK_SHUFFLE -> blockShuffle(movable);
            case WITHIN_DIVISION -> withinDivision(movable);
            case SCATTER -> {
                if (!scatter(all, movable, pool.size())) {
                    log.debug("Not enough slot capacity to scatter {} matches; shuffling within divisions", movable.size());
                    withinDivision(movable);
                }
            }
        }
        FieldAllocator.reassign(all, pool, random);
        referees.reassign(all);
        return copy;
    }

    private void blockShuffle(List<Match> movable) {
        List<Integer> slots = new ArrayList<>();
        for (Match m : movable) slots.add(m.timeSlot());
        Collections.sort(slots);

        Map<Division, List<Match>> byDivision = byDivision(movable);
        List<Division> order = new ArrayList<>(byDivision.keySet());
        random.shuffle(order);

        int next = 0;
        for (Division d : order) {
            List<Match> matches = byDivision.get(d);
            random.shuffle(matches);
            for (Match m : matches) m.setTimeSlot(slots.get(next++));
        }
    }

    private void withinDivision(List<Match> movable) {
        byDivision(movable).values().forEach(matches -> {
            List<Integer> slots = new ArrayList<>();
            for (Match m : matches) slots.add(m.timeSlot());
            random.shuffle(slots);
            for (int i = 0; i < matches.size(); i++) matches.get(i).setTimeSlot(slots.get(i));
        });
    }

    /**
     * Every current movable slot keeps at least one match, so the set of distinct slots survives.
     * Returns false, leaving the matches untouched, when the slots cannot hold all movable matches.
     */
    private boolean scatter(List<Match> all, List<Match> movable, int fieldCount) {
        if (fieldCount == 0) return false;
        Set<Integer> targets = new TreeSet<>();
        for (Match m : movable) targets.add(m.timeSlot());

        Map<Integer, Integer> capacity = new HashMap<>();
        for (int slot : targets) capacity.put(slot, fieldCount);
        for (Match m : all) {
            if (!targets.contains(m.timeSlot())) continue;
            if (m.isSpecialActivity()) return false;
            if (m.isRegular() && !m.isMovable()) capacity.merge(m.timeSlot(), -1, Integer::sum);
        }
        int total = 0;
        for (int c : capacity.values()) {
            if (c < 1) return false;
            total += c;
        }
        if (total < movable.size()) return false;

        List<Match> shuffled = new ArrayList<>(movable);
        random.shuffle(shuffled);
        List<Integer> slotOrder = new ArrayList<>(targets);
        random.shuffle(slotOrder);

        int i = 0;
        for (int slot : slotOrder) {
            shuffled.get(i++).setTimeSlot(slot);
            capacity.merge(slot, -1, Integer::sum);
        }
        for (; i < shuffled.size(); i++) {
            List<Integer> open = slotOrder.stream().filter(s -> capacity.get(s) > 0).toList();
            int slot = random.pick(open);
            shuffled.get(i).setTimeSlot(slot);
            capacity.merge(slot, -1, Integer::sum);
        }
        return true;
    }

    private static Map<Division, List<Match>> byDivision(List<Match> matches) {
        Map<Division, List<Match>> out = new EnumMap<>(Division.class);
        for (Match m : matches) out.computeIfAbsent(m.division(), d -> new ArrayList<>()).add(m);
        return out;
    }
}
