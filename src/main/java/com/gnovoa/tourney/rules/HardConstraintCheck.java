package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Physical constraints that hold regardless of the configured rules: a team can only be in one place
 * per slot, never referees its own match, and a field hosts one regular match per slot.
 *
 * <p>Not a {@link ScheduleRule}: it cannot be configured, only run first by {@link Schedule#evaluate}.
 * Every finding is critical and weighs {@link #WEIGHT}.
 */
public final class HardConstraintCheck {

    /** Weight of every hard finding; equal to the highest rule priority. */
    public static final int WEIGHT = 10;

    public static final String NAME = "Prevent team double-booking";

    private HardConstraintCheck() {}

    public static List<RuleViolation> check(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byTimeSlot(schedule.matches()).forEach((slot, slotMatches) -> {
            checkDoubleBooking(slot, slotMatches, out);
            checkSelfRefereeing(slot, slotMatches, out);
            checkFieldConflicts(slot, slotMatches, out);
        });
        return out;
    }

    private static void checkDoubleBooking(int slot, List<Match> slotMatches, List<RuleViolation> out) {
        Map<Team, List<Match>> assignments = new LinkedHashMap<>();
        for (Match m : slotMatches) {
            for (Team t : MatchGroups.involvedTeams(m)) {
                assignments.computeIfAbsent(t, k -> new ArrayList<>()).add(m);
            }
        }
        assignments.forEach((team, matches) -> {
            if (matches.size() > 1) {
                out.add(critical(
                        "Team %s has %d assignments in slot %d".formatted(team.name(), matches.size(), slot),
                        matches));
            }
        });
    }

    private static void checkSelfRefereeing(int slot, List<Match> slotMatches, List<RuleViolation> out) {
        for (Match m : slotMatches) {
            Team ref = m.refereeTeam();
            if (ref == null || ref.isPlaceholder() || !m.plays(ref)) continue;
            out.add(critical(
                    "Team %s referees its own match in slot %d".formatted(ref.name(), slot),
                    List.of(m)));
        }
    }

    private static void checkFieldConflicts(int slot, List<Match> slotMatches, List<RuleViolation> out) {
        Map<String, List<Match>> byField = new LinkedHashMap<>();
        for (Match m : slotMatches) {
            if (!m.isRegular()) continue;
            byField.computeIfAbsent(m.field(), k -> new ArrayList<>()).add(m);
        }
        byField.forEach((field, matches) -> {
            if (matches.size() > 1) {
                out.add(critical(
                        "Field %s has %d matches in slot %d".formatted(field, matches.size(), slot),
                        matches));
            }
        });
    }

    private static RuleViolation critical(String description, List<Match> matches) {
        return new RuleViolation(NAME, description, matches, ViolationLevel.CRITICAL, WEIGHT);
    }
}
