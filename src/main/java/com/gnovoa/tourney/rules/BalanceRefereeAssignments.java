package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Spread of referee duties across the teams that referee at all. */
public final class BalanceRefereeAssignments extends AbstractScheduleRule {

    public static final String NAME = "Balance referee assignments";

    private final int maxRefereeDifference;

    public BalanceRefereeAssignments(int priority, int maxRefereeDifference) {
        super(NAME, priority);
        this.maxRefereeDifference = maxRefereeDifference;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        Map<Team, Integer> counts = new LinkedHashMap<>();
        for (Match m : MatchGroups.regular(schedule.matches())) {
            Team ref = m.refereeTeam();
            if (ref != null && !ref.isPlaceholder()) counts.merge(ref, 1, Integer::sum);
        }
        if (counts.isEmpty()) return List.of();

        int min = Collections.min(counts.values());
        int max = Collections.max(counts.values());
        if (max - min <= maxRefereeDifference) return List.of();
        return List.of(violation(
                "Referee assignment imbalance: %d-%d assignments (max difference: %d)".formatted(min, max, maxRefereeDifference),
                List.of(), ViolationLevel.WARNING));
    }
}
