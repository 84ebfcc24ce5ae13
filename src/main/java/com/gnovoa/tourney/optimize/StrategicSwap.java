package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;
import java.util.Optional;

/** Swap moves aimed at the matches the worst violations point at. */
final class StrategicSwap {

    private StrategicSwap() {}

    /**
     * Picks one of the highest-priority violations that names a movable match and swaps two of its
     * matches, or one of them with any other movable match.
     *
     * @param schedule an evaluated schedule
     */
    static Optional<Schedule> targeted(Schedule schedule, RandomSource random) {
        List<RuleViolation> candidates = schedule.violations().stream()
                .filter(v -> v.matches().stream().anyMatch(Match::isMovable))
                .toList();
        if (candidates.isEmpty()) return Optional.empty();

        int top = candidates.stream().mapToInt(RuleViolation::priority).max().orElseThrow();
        RuleViolation target = random.pick(candidates.stream().filter(v -> v.priority() == top).toList());
        List<Match> named = target.matches().stream().filter(Match::isMovable).distinct().toList();

        if (named.size() >= 2) {
            int i = random.nextIntInclusive(0, named.size() - 1);
            int j = random.nextIntInclusive(0, named.size() - 2);
            if (j >= i) j++;
            return schedule.swapMatches(named.get(i), named.get(j));
        }
        Match a = named.get(0);
        List<Match> others = schedule.matches().stream().filter(m -> m.isMovable() && m != a).toList();
        if (others.isEmpty()) return Optional.empty();
        return schedule.swapMatches(a, random.pick(others));
    }

    /** Swaps two movable matches chosen uniformly. */
    static Optional<Schedule> random(Schedule schedule, RandomSource random) {
        List<Match> movable = schedule.matches().stream().filter(Match::isMovable).toList();
        if (movable.size() < 2) return Optional.empty();
        int i = random.nextIntInclusive(0, movable.size() - 1);
        int j = random.nextIntInclusive(0, movable.size() - 2);
        if (j >= i) j++;
        return schedule.swapMatches(movable.get(i), movable.get(j));
    }
}
