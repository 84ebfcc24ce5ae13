package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;

/** A player's first game should not come before slot {@code minWarmupSlots + 1}. */
public final class EnsurePlayerWarmupTime extends AbstractScheduleRule {

    public static final String NAME = "Ensure player warm-up time";

    private final int minWarmupSlots;

    public EnsurePlayerWarmupTime(int priority, int minWarmupSlots) {
        super(NAME, priority);
        this.minWarmupSlots = minWarmupSlots;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byPlayer(MatchGroups.regular(schedule.matches())).forEach((player, games) -> {
            Match first = games.get(0);
            if (first.timeSlot() < minWarmupSlots + 1) {
                out.add(violation(
                        "Player %s has first game in slot %d (needs %d warm-up slots)"
                                .formatted(player, first.timeSlot(), minWarmupSlots),
                        List.of(first), ViolationLevel.NOTE));
            }
        });
        return out;
    }
}
