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
 * Flags runs of games in consecutive slots, per team and per player. Refereeing neither extends nor
 * breaks a run.
 *
 * <p>A player run is dropped when one of the player's teams already reports the exact same run, so
 * only streaks the team view cannot see (a player on teams in two divisions) surface separately.
 */
public final class AvoidBackToBackGames extends AbstractScheduleRule {

    public static final String NAME = "Avoid back-to-back games";

    public AvoidBackToBackGames(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<Match> games = MatchGroups.regular(schedule.matches());
        List<RuleViolation> out = new ArrayList<>();

        Map<Team, List<List<Match>>> teamRuns = new LinkedHashMap<>();
        MatchGroups.byPlayingTeam(games).forEach((team, matches) -> {
            List<List<Match>> runs = MatchGroups.consecutiveRuns(matches);
            teamRuns.put(team, runs);
            for (List<Match> run : runs) out.add(streak("Team " + team.name(), run));
        });

        MatchGroups.byPlayer(games).forEach((player, matches) -> {
            for (List<Match> run : MatchGroups.consecutiveRuns(matches)) {
                if (!coveredByTeam(player, run, teamRuns)) out.add(streak("Player " + player, run));
            }
        });
        return out;
    }

    private static boolean coveredByTeam(String player, List<Match> run, Map<Team, List<List<Match>>> teamRuns) {
        return teamRuns.entrySet().stream()
                .filter(e -> e.getKey().hasPlayer(player))
                .anyMatch(e -> e.getValue().contains(run));
    }

    private RuleViolation streak(String entity, List<Match> run) {
        int first = run.get(0).timeSlot();
        int last = run.get(run.size() - 1).timeSlot();
        String description = run.size() == 2
                ? "%s: 2 back-to-back games in time slots %d and %d".formatted(entity, first, last)
                : "%s: %d consecutive games in time slots %d and %d".formatted(entity, run.size(), first, last);
        return violation(description, run, ViolationLevel.WARNING);
    }
}
