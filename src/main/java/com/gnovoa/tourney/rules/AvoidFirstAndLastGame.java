package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A team or player should not be at both ends of the day. The first period is every setup activity
 * plus the earliest regular slot; the last period is the latest regular slot plus every pack-down.
 * Teams count when playing or refereeing, players when playing.
 */
public final class AvoidFirstAndLastGame extends AbstractScheduleRule {

    public static final String NAME = "Avoid having first and last game";

    public AvoidFirstAndLastGame(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<Match> all = MatchGroups.sortedBySlot(schedule.matches());
        List<Match> regular = all.stream().filter(Match::isRegular).toList();
        if (regular.isEmpty()) return List.of();

        int firstSlot = regular.get(0).timeSlot();
        int lastSlot = regular.get(regular.size() - 1).timeSlot();

        List<Match> firstPeriod = new ArrayList<>(ofType(all, ActivityType.SETUP));
        regular.stream().filter(m -> m.timeSlot() == firstSlot).forEach(firstPeriod::add);
        List<Match> lastPeriod = new ArrayList<>();
        regular.stream().filter(m -> m.timeSlot() == lastSlot).forEach(lastPeriod::add);
        lastPeriod.addAll(ofType(all, ActivityType.PACKING_DOWN));

        List<Match> relevant = new ArrayList<>(firstPeriod);
        for (Match m : lastPeriod) if (!relevant.contains(m)) relevant.add(m);

        List<RuleViolation> out = new ArrayList<>();
        Set<Team> lastTeams = teams(lastPeriod);
        List<Team> flaggedTeams = new ArrayList<>();
        for (Team team : teams(firstPeriod)) {
            if (!lastTeams.contains(team)) continue;
            flaggedTeams.add(team);
            out.add(violation(
                    "Team %s participates in both first period (setup + first game) and last period (last game + packdown) of the day"
                            .formatted(team.name()),
                    relevant.stream().filter(m -> m.involves(team)).toList(),
                    ViolationLevel.ALERT));
        }

        Set<String> lastPlayers = players(lastPeriod);
        for (String player : players(firstPeriod)) {
            if (!lastPlayers.contains(player)) continue;
            if (flaggedTeams.stream().anyMatch(t -> t.hasPlayer(player))) continue;
            out.add(violation(
                    "Player %s participates in both first period (setup + first game) and last period (last game + packdown) of the day"
                            .formatted(player),
                    relevant.stream().filter(m -> m.hasPlayer(player)).toList(),
                    ViolationLevel.ALERT));
        }
        return out;
    }

    private static List<Match> ofType(List<Match> matches, ActivityType type) {
        return matches.stream().filter(m -> m.activityType() == type).toList();
    }

    private static Set<Team> teams(List<Match> matches) {
        Set<Team> teams = new LinkedHashSet<>();
        for (Match m : matches) teams.addAll(MatchGroups.involvedTeams(m));
        return teams;
    }

    private static Set<String> players(List<Match> matches) {
        Set<String> players = new LinkedHashSet<>();
        for (Match m : matches) {
            for (Player p : MatchGroups.playersIn(m)) players.add(p.name());
        }
        return players;
    }
}
