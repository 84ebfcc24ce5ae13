package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/** A referee team should not play in the slot right after it referees. Playing then refereeing is fine. */
public final class AvoidReffingBeforePlaying extends AbstractScheduleRule {

    public static final String NAME = "Avoid refereeing before playing";

    public AvoidReffingBeforePlaying(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        TreeMap<Integer, List<Match>> slots = MatchGroups.byTimeSlot(MatchGroups.regular(schedule.matches()));
        List<RuleViolation> out = new ArrayList<>();
        slots.forEach((slot, matches) -> {
            List<Match> next = slots.getOrDefault(slot + 1, List.of());
            for (Match reffed : matches) {
                Team ref = reffed.refereeTeam();
                if (ref == null || ref.isPlaceholder()) continue;
                for (Match played : next) {
                    if (!played.plays(ref)) continue;
                    out.add(violation(
                            "Team %s referees in slot %d and plays in slot %d".formatted(ref.name(), slot, slot + 1),
                            List.of(reffed, played), ViolationLevel.NOTE));
                }
            }
        });
        return out;
    }
}
