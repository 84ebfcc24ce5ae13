package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * A team staffing a setup activity must not play in the very next slot. Each such match is reported
 * as a warning naming the team and the slot; the default priority is the maximum.
 */
public final class AvoidPlayingAfterSetup extends AbstractScheduleRule {

    public static final String NAME = "Avoid playing immediately after setup";

    public AvoidPlayingAfterSetup(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        TreeMap<Integer, List<Match>> regular = MatchGroups.byTimeSlot(MatchGroups.regular(schedule.matches()));
        List<RuleViolation> out = new ArrayList<>();
        for (Match setup : MatchGroups.sortedBySlot(schedule.matches())) {
            if (setup.activityType() != ActivityType.SETUP) continue;
            int nextSlot = setup.timeSlot() + 1;
            for (Team team : MatchGroups.involvedTeams(setup)) {
                for (Match next : regular.getOrDefault(nextSlot, List.of())) {
                    if (!next.plays(team)) continue;
                    out.add(violation(
                            "Team %s does setup in slot %d and plays immediately after in slot %d - CRITICAL VIOLATION"
                                    .formatted(team.name(), setup.timeSlot(), nextSlot),
                            List.of(setup, next), ViolationLevel.WARNING));
                }
            }
        }
        return out;
    }
}
