package com.gnovoa.tourney.schedule;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.HardConstraintCheck;
import com.gnovoa.tourney.rules.ScheduleRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An ordered set of matches with the result of its last evaluation.
 *
 * <p>A schedule owns its matches. Every operator works on a {@link #deepCopy()} and returns the copy,
 * so a schedule handed out (to an observer, to the caller) is never changed by a later search step.
 * Operators that cannot apply (locked match, unknown match, no room) return {@link Optional#empty()}.
 */
public final class Schedule {

    private final List<Match> matches;
    private List<RuleViolation> violations = List.of();
    private int score;
    private boolean evaluated;

    /** Takes ownership of the given match instances. */
    public Schedule(Collection<Match> matches) {
        this.matches = new ArrayList<>(matches);
    }

    public List<Match> matches() {
        return List.copyOf(matches);
    }

    List<Match> mutableMatches() {
        return matches;
    }

    public List<RuleViolation> violations() {
        return violations;
    }

    /** Priority-weighted violation count of the last evaluation; 0 is perfect. */
    public int score() {
        return score;
    }

    public boolean isEvaluated() {
        return evaluated;
    }

    public boolean hasCriticalViolation() {
        return violations.stream().anyMatch(RuleViolation::isCritical);
    }

    /**
     * Sorts matches by time slot, runs the hard constraint check and then every rule.
     *
     * @return the new score, the sum of every violation's priority
     */
    public int evaluate(List<? extends ScheduleRule> rules) {
        matches.sort(Comparator.comparingInt(Match::timeSlot));
        List<RuleViolation> found = new ArrayList<>(HardConstraintCheck.check(this));
        for (ScheduleRule rule : rules) {
            for (RuleViolation v : rule.evaluate(this)) found.add(v.withPriority(rule.priority()));
        }
        int total = 0;
        for (RuleViolation v : found) total += v.priority();
        this.violations = List.copyOf(found);
        this.score = total;
        this.evaluated = true;
        return total;
    }

    /** Independent copy: new match instances, shared teams, violations remapped onto the copies. */
    public Schedule deepCopy() {
        Map<Match, Match> copies = new IdentityHashMap<>();
        List<Match> copied = new ArrayList<>(matches.size());
        for (Match m : matches) {
            Match c = m.copy();
            copies.put(m, c);
            copied.add(c);
        }
        Schedule out = new Schedule(copied);
        out.violations = violations.stream()
                .map(v -> v.withMatches(v.matches().stream().map(m -> copies.getOrDefault(m, m)).toList()))
                .toList();
        out.score = score;
        out.evaluated = evaluated;
        return out;
    }

    /** Unevaluated copy of the matches only. */
    Schedule copyMatches() {
        List<Match> copied = new ArrayList<>(matches.size());
        for (Match m : matches) copied.add(m.copy());
        return new Schedule(copied);
    }

    public Schedule randomize(RandomSource random) {
        return new ScheduleRandomizer(random).randomize(this);
    }

    /** Exchanges slot and field of two matches. */
    public Optional<Schedule> swapMatches(Match a, Match b) {
        int ia = indexOf(a);
        int ib = indexOf(b);
        if (ia < 0 || ib < 0 || ia == ib) return Optional.empty();
        if (!matches.get(ia).isMovable() || !matches.get(ib).isMovable()) return Optional.empty();

        Schedule copy = copyMatches();
        Match ca = copy.matches.get(ia);
        Match cb = copy.matches.get(ib);
        int slot = ca.timeSlot();
        String field = ca.field();
        ca.setTimeSlot(cb.timeSlot());
        ca.setField(cb.field());
        cb.setTimeSlot(slot);
        cb.setField(field);
        return Optional.of(copy);
    }

    /** Moves every match of slot {@code t1} to {@code t2} and vice versa. Fields are kept. */
    public Optional<Schedule> swapTimeSlots(int t1, int t2) {
        for (Match m : matches) {
            if ((m.timeSlot() == t1 || m.timeSlot() == t2) && !m.isMovable()) return Optional.empty();
        }
        Schedule copy = copyMatches();
        if (t1 == t2) return Optional.of(copy);
        for (Match m : copy.matches) {
            if (m.timeSlot() == t1) m.setTimeSlot(t2);
            else if (m.timeSlot() == t2) m.setTimeSlot(t1);
        }
        return Optional.of(copy);
    }

    /**
     * Moves matches into an existing slot that holds no special activity, on fields that are free there.
     */
    public Optional<Schedule> moveMatchesToTimeSlot(List<Match> toMove, int targetSlot) {
        if (toMove.isEmpty()) return Optional.empty();
        Set<Integer> indexes = new LinkedHashSet<>();
        for (Match m : toMove) {
            int i = indexOf(m);
            if (i < 0 || !matches.get(i).isMovable()) return Optional.empty();
            indexes.add(i);
        }
        boolean slotExists = false;
        for (Match m : matches) {
            if (m.timeSlot() != targetSlot) continue;
            if (m.isSpecialActivity()) return Optional.empty();
            slotExists = true;
        }
        if (!slotExists) return Optional.empty();

        List<String> pool = fieldPool();
        Set<String> taken = new LinkedHashSet<>();
        for (int i = 0; i < matches.size(); i++) {
            Match m = matches.get(i);
            if (m.timeSlot() == targetSlot && m.isRegular() && !indexes.contains(i)) taken.add(m.field());
        }
        List<String> free = pool.stream().filter(f -> !taken.contains(f)).toList();
        if (free.size() < indexes.size()) return Optional.empty();

        Schedule copy = copyMatches();
        int next = 0;
        for (int i : indexes) {
            Match c = copy.matches.get(i);
            c.setTimeSlot(targetSlot);
            c.setField(free.get(next++));
        }
        return Optional.of(copy);
    }

    /**
     * Copy whose movable matches in the given divisions take slot, field and referee from the match
     * with the same id in {@code donor}. Field clashes with the other divisions are repaired.
     *
     * @return empty if the result would lose one of this schedule's regular slots or put more regular
     *     matches in a slot than there are fields
     */
    public Optional<Schedule> withDivisionsFrom(Schedule donor, Set<Division> divisions) {
        Map<String, Match> donorById = new HashMap<>();
        for (Match m : donor.matches) donorById.put(m.matchId(), m);

        Schedule child = copyMatches();
        for (Match m : child.matches) {
            if (!m.isMovable() || !divisions.contains(m.division())) continue;
            Match source = donorById.get(m.matchId());
            if (source == null) continue;
            m.setTimeSlot(source.timeSlot());
            m.setField(source.field());
            m.setRefereeTeam(source.refereeTeam());
        }

        if (!child.regularTimeSlots().equals(regularTimeSlots())) return Optional.empty();
        int fieldCount = fieldPool().size();
        Map<Integer, Integer> perSlot = new HashMap<>();
        for (Match m : child.matches) {
            if (m.isRegular() && perSlot.merge(m.timeSlot(), 1, Integer::sum) > fieldCount) return Optional.empty();
        }
        FieldAllocator.resolveConflicts(child.matches, fieldPool());
        return Optional.of(child);
    }

    /** Copy in which no slot has two regular matches on the same field, wherever enough fields exist. */
    public Schedule fixFieldConflicts() {
        Schedule copy = copyMatches();
        FieldAllocator.resolveConflicts(copy.matches, fieldPool());
        return copy;
    }

    /** Distinct fields used by regular matches, in order of first use. */
    public List<String> fieldPool() {
        return FieldAllocator.fieldPool(matches);
    }

    public SortedSet<Integer> timeSlots() {
        SortedSet<Integer> slots = new TreeSet<>();
        for (Match m : matches) slots.add(m.timeSlot());
        return slots;
    }

    public SortedSet<Integer> regularTimeSlots() {
        SortedSet<Integer> slots = new TreeSet<>();
        for (Match m : matches) if (m.isRegular()) slots.add(m.timeSlot());
        return slots;
    }

    /** The match in this schedule with the same teams, slot and field as {@code probe}. */
    public Optional<Match> find(Match probe) {
        int i = indexOf(probe);
        return i < 0 ? Optional.empty() : Optional.of(matches.get(i));
    }

    private int indexOf(Match probe) {
        if (probe == null) return -1;
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i) == probe) return i;
        }
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i).sameFixture(probe)) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return "Schedule[" + matches.size() + " matches, score " + (evaluated ? score : "?") + "]";
    }
}
