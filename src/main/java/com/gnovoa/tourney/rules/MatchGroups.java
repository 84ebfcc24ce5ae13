package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.Team;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Grouping helpers shared by the rules. Every result keeps the time-slot order of its input. */
public final class MatchGroups {

    private MatchGroups() {}

    public static List<Match> sortedBySlot(List<Match> matches) {
        List<Match> sorted = new ArrayList<>(matches);
        sorted.sort(Comparator.comparingInt(Match::timeSlot));
        return sorted;
    }

    public static List<Match> regular(List<Match> matches) {
        return sortedBySlot(matches).stream().filter(Match::isRegular).toList();
    }

    public static TreeMap<Integer, List<Match>> byTimeSlot(List<Match> matches) {
        TreeMap<Integer, List<Match>> slots = new TreeMap<>();
        for (Match m : matches) slots.computeIfAbsent(m.timeSlot(), k -> new ArrayList<>()).add(m);
        return slots;
    }

    /** Matches each team plays in (not referees), placeholder excluded. */
    public static Map<Team, List<Match>> byPlayingTeam(List<Match> matches) {
        Map<Team, List<Match>> teams = new LinkedHashMap<>();
        for (Match m : sortedBySlot(matches)) {
            for (Team t : List.of(m.team1(), m.team2())) {
                if (t.isPlaceholder()) continue;
                List<Match> list = teams.computeIfAbsent(t, k -> new ArrayList<>());
                if (!list.contains(m)) list.add(m);
            }
        }
        return teams;
    }

    /** Matches each team plays in or referees, placeholder excluded. */
    public static Map<Team, List<Match>> byInvolvedTeam(List<Match> matches) {
        Map<Team, List<Match>> teams = new LinkedHashMap<>();
        for (Match m : sortedBySlot(matches)) {
            for (Team t : involvedTeams(m)) {
                teams.computeIfAbsent(t, k -> new ArrayList<>()).add(m);
            }
        }
        return teams;
    }

    /** Matches each player plays in, by player name. */
    public static Map<String, List<Match>> byPlayer(List<Match> matches) {
        Map<String, List<Match>> players = new LinkedHashMap<>();
        for (Match m : sortedBySlot(matches)) {
            for (Player p : playersIn(m)) {
                List<Match> list = players.computeIfAbsent(p.name(), k -> new ArrayList<>());
                if (!list.contains(m)) list.add(m);
            }
        }
        return players;
    }

    public static List<Player> playersIn(Match match) {
        List<Player> players = new ArrayList<>(match.team1().players());
        players.addAll(match.team2().players());
        return players;
    }

    /** Distinct playing and refereeing teams of a match, placeholder excluded. */
    public static List<Team> involvedTeams(Match match) {
        List<Team> teams = new ArrayList<>(3);
        for (Team t : new Team[]{match.team1(), match.team2(), match.refereeTeam()}) {
            if (t != null && !t.isPlaceholder() && !teams.contains(t)) teams.add(t);
        }
        return teams;
    }

    /**
     * Maximal runs (length 2 or more) of strictly consecutive time slots in a slot-ordered list.
     */
    public static List<List<Match>> consecutiveRuns(List<Match> slotOrdered) {
        List<List<Match>> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= slotOrdered.size(); i++) {
            boolean breaks = i == slotOrdered.size()
                    || slotOrdered.get(i).timeSlot() != slotOrdered.get(i - 1).timeSlot() + 1;
            if (breaks) {
                if (i - start >= 2) runs.add(List.copyOf(slotOrdered.subList(start, i)));
                start = i;
            }
        }
        return runs;
    }
}
