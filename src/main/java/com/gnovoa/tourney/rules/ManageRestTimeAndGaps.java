package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;

/** Per player: empty slots between consecutive games must be at least {@code minRestSlots} and at most {@code maxGapSlots}. */
public final class ManageRestTimeAndGaps extends AbstractScheduleRule {

    public static final String NAME = "Manage rest time and gaps";

    private final int minRestSlots;
    private final int maxGapSlots;

    public ManageRestTimeAndGaps(int priority, int minRestSlots, int maxGapSlots) {
        super(NAME, priority);
        if (minRestSlots > maxGapSlots) {
            throw new IllegalArgumentException("minRestSlots must not exceed maxGapSlots");
        }
        this.minRestSlots = minRestSlots;
        this.maxGapSlots = maxGapSlots;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byPlayer(MatchGroups.regular(schedule.matches())).forEach((player, games) -> {
            for (int i = 1; i < games.size(); i++) {
                Match prev = games.get(i - 1);
                Match cur = games.get(i);
                int gap = cur.timeSlot() - prev.timeSlot() - 1;
                if (gap < minRestSlots) {
                    out.add(violation(
                            "Player %s has insufficient rest (%d slots) between games in slots %d and %d"
                                    .formatted(player, gap, prev.timeSlot(), cur.timeSlot()),
                            List.of(prev, cur), ViolationLevel.NOTE));
                } else if (gap > maxGapSlots) {
                    out.add(violation(
                            "Player %s has %d-slot gap between games (slots %d and %d)"
                                    .formatted(player, gap, prev.timeSlot(), cur.timeSlot()),
                            List.of(prev, cur), ViolationLevel.WARNING));
                }
            }
        });
        return out;
    }
}
