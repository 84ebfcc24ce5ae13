package com.gnovoa.tourney.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A player and the team it plays for in each division (at most one team per division).
 *
 * @param name player name, unique across the tournament
 * @param teams team name by division
 */
public record Player(String name, Map<Division, String> teams) {

    public Player {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Player name is required");
        EnumMap<Division, String> copy = new EnumMap<>(Division.class);
        if (teams != null) {
            teams.forEach((division, team) -> {
                if (team != null && !team.isBlank()) copy.put(division, team.trim());
            });
        }
        teams = Map.copyOf(copy);
    }

    public static Player of(String name, String mixedTeam, String genderedTeam, String clothTeam) {
        Map<Division, String> teams = new EnumMap<>(Division.class);
        if (mixedTeam != null) teams.put(Division.MIXED, mixedTeam);
        if (genderedTeam != null) teams.put(Division.GENDERED, genderedTeam);
        if (clothTeam != null) teams.put(Division.CLOTH, clothTeam);
        return new Player(name, teams);
    }

    public Optional<String> teamIn(Division division) {
        return Optional.ofNullable(teams.get(division));
    }
}
