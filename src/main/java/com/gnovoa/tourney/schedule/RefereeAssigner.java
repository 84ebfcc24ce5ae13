package com.gnovoa.tourney.schedule;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.MatchGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redistributes referees after matches moved. Each division draws from the referees its movable
 * matches already had; a referee must not be on court or refereeing elsewhere in the same slot.
 * Locked matches and special activities keep their referee.
 */
final class RefereeAssigner {

    private static final Logger log = LoggerFactory.getLogger(RefereeAssigner.class);

    private final RandomSource random;

    RefereeAssigner(RandomSource random) {
        this.random = random;
    }

    void reassign(List<Match> matches) {
        Map<Division, List<Team>> pools = new EnumMap<>(Division.class);
        Map<Division, Set<Team>> divisionTeams = new EnumMap<>(Division.class);
        List<Match> targets = new ArrayList<>();

        for (Match m : matches) {
            if (!m.isRegular()) continue;
            Set<Team> teams = divisionTeams.computeIfAbsent(m.division(), d -> new LinkedHashSet<>());
            if (!m.team1().isPlaceholder()) teams.add(m.team1());
            if (!m.team2().isPlaceholder()) teams.add(m.team2());
        }
        for (Match m : matches) {
            if (!m.isMovable()) continue;
            List<Team> pool = pools.computeIfAbsent(m.division(), d -> new ArrayList<>());
            Team ref = m.refereeTeam();
            if (ref != null && !ref.isPlaceholder() && !pool.contains(ref)) pool.add(ref);
        }
        for (Match m : matches) {
            if (!m.isMovable() || pools.get(m.division()).isEmpty()) continue;
            m.setRefereeTeam(null);
            targets.add(m);
        }
        pools.values().forEach(random::shuffle);

        Map<Integer, Set<Team>> busy = new HashMap<>();
        for (Match m : matches) {
            busy.computeIfAbsent(m.timeSlot(), s -> new HashSet<>()).addAll(MatchGroups.involvedTeams(m));
        }

        targets.sort(Comparator.comparingInt(Match::timeSlot));
        Map<Division, Integer> cursor = new EnumMap<>(Division.class);
        for (Match m : targets) {
            Set<Team> slotBusy = busy.get(m.timeSlot());
            List<Team> pool = pools.get(m.division());
            int start = cursor.getOrDefault(m.division(), 0);

            Team chosen = null;
            for (int k = 0; k < pool.size() && chosen == null; k++) {
                Team candidate = pool.get((start + k) % pool.size());
                if (!slotBusy.contains(candidate)) {
                    chosen = candidate;
                    cursor.put(m.division(), start + k + 1);
                }
            }
            if (chosen == null) {
                chosen = divisionTeams.getOrDefault(m.division(), Set.of()).stream()
                        .filter(t -> !slotBusy.contains(t))
                        .findFirst()
                        .orElse(null);
            }
            if (chosen == null) {
                log.debug("No eligible referee for {} in slot {}", m, m.timeSlot());
                continue;
            }
            m.setRefereeTeam(chosen);
            slotBusy.add(chosen);
        }
    }
}
