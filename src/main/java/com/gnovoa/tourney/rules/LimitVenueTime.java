package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Limits the time from a team's or player's first to last appearance (inclusive), measured in slots of
 * {@code minutesPerSlot}. Teams appear when playing, refereeing or staffing an activity; players when
 * their team is on court.
 *
 * <p>A player finding is kept only if none of the player's flagged teams already covers it, i.e. the
 * player's time exceeds every such team's time by more than {@code toleranceHours}.
 */
public final class LimitVenueTime extends AbstractScheduleRule {

    public static final String NAME = "Limit venue time";

    private final double maxHours;
    private final int minutesPerSlot;
    private final double toleranceHours;

    public LimitVenueTime(int priority, double maxHours, int minutesPerSlot, double toleranceHours) {
        super(NAME, priority);
        if (maxHours <= 0 || minutesPerSlot <= 0) {
            throw new IllegalArgumentException("maxHours and minutesPerSlot must be positive");
        }
        this.maxHours = maxHours;
        this.minutesPerSlot = minutesPerSlot;
        this.toleranceHours = toleranceHours;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<Match> matches = schedule.matches();
        List<RuleViolation> out = new ArrayList<>();

        Map<Team, Double> flaggedTeams = new LinkedHashMap<>();
        MatchGroups.byInvolvedTeam(matches).forEach((team, teamMatches) -> {
            if (teamMatches.size() < 2) return;
            double hours = hoursSpanned(teamMatches);
            if (hours > maxHours) {
                flaggedTeams.put(team, hours);
                out.add(violation(describe("Team " + team.name(), hours), teamMatches, ViolationLevel.WARNING));
            }
        });

        MatchGroups.byPlayer(matches).forEach((player, playerMatches) -> {
            if (playerMatches.size() < 2) return;
            double hours = hoursSpanned(playerMatches);
            if (hours <= maxHours) return;
            boolean covered = flaggedTeams.entrySet().stream()
                    .anyMatch(e -> e.getKey().hasPlayer(player) && hours <= e.getValue() + toleranceHours);
            if (!covered) {
                out.add(violation(describe("Player " + player, hours), playerMatches, ViolationLevel.WARNING));
            }
        });
        return out;
    }

    private double hoursSpanned(List<Match> slotOrdered) {
        int first = slotOrdered.get(0).timeSlot();
        int last = slotOrdered.get(slotOrdered.size() - 1).timeSlot();
        return (last - first + 1) * minutesPerSlot / 60.0;
    }

    private String describe(String entity, double hours) {
        return String.format(Locale.ROOT, "%s needs to be at venue for %.1f hours (max: %.1fh)", entity, hours, maxHours);
    }
}
