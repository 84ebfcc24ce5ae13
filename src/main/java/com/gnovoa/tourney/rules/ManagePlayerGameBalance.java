package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Caps games per player and keeps the per-division spread of game counts small. */
public final class ManagePlayerGameBalance extends AbstractScheduleRule {

    public static final String NAME = "Manage player game balance";

    private final int maxGames;
    private final int maxGameDifference;

    public ManagePlayerGameBalance(int priority, int maxGames, int maxGameDifference) {
        super(NAME, priority);
        this.maxGames = maxGames;
        this.maxGameDifference = maxGameDifference;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        Map<String, List<Match>> byPlayer = MatchGroups.byPlayer(MatchGroups.regular(schedule.matches()));

        Map<Division, Map<String, Integer>> perDivision = new EnumMap<>(Division.class);
        byPlayer.forEach((player, games) -> {
            if (games.size() > maxGames) {
                out.add(violation(
                        "Player %s is scheduled for %d games (max: %d)".formatted(player, games.size(), maxGames),
                        games, ViolationLevel.WARNING));
            }
            for (Match m : games) {
                perDivision.computeIfAbsent(m.division(), d -> new LinkedHashMap<>()).merge(player, 1, Integer::sum);
            }
        });

        perDivision.forEach((division, counts) -> {
            int min = Collections.min(counts.values());
            int max = Collections.max(counts.values());
            if (max - min > maxGameDifference) {
                out.add(violation(
                        "Game distribution imbalance in %s: %d-%d games (max difference: %d)"
                                .formatted(division.id(), min, max, maxGameDifference),
                        List.of(), ViolationLevel.WARNING));
            }
        });
        return out;
    }
}
