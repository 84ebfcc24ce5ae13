package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public final class DetectMixedDivisionsInTimeSlot extends AbstractScheduleRule {

    public static final String NAME = "Detect mixed divisions in time slot";

    public DetectMixedDivisionsInTimeSlot(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byTimeSlot(MatchGroups.regular(schedule.matches())).forEach((slot, matches) -> {
            Set<Division> divisions = new LinkedHashSet<>();
            for (Match m : matches) divisions.add(m.division());
            if (divisions.size() > 1) {
                String names = divisions.stream().map(Division::id).collect(Collectors.joining(", "));
                out.add(violation("Time slot %d has multiple divisions: %s".formatted(slot, names),
                        matches, ViolationLevel.WARNING));
            }
        });
        return out;
    }
}
