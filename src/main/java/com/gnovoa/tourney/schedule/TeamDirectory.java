package com.gnovoa.tourney.schedule;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.Team;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves team names into the shared {@link Team} instances matches point at.
 *
 * <p>Teams come from player memberships, plus any names declared explicitly (teams without listed
 * players). The directory is built once per imported schedule and fails fast on names that cannot be
 * resolved, so the engine never sees a match between teams absent from its division.
 */
public final class TeamDirectory {

  /** Teams by division, then by name, in order of first appearance. */
  private final Map<Division, Map<String, Team>> teams = new EnumMap<>(Division.class);

  /**
   * Builds the directory.
   *
   * @param players every player with their team per division
   * @param declaredTeams extra team names per division; may be empty
   */
  public TeamDirectory(Collection<Player> players, Map<Division, ? extends Collection<String>> declaredTeams) {
    Map<Division, Map<String, List<Player>>> rosters = new EnumMap<>(Division.class);
    if (declaredTeams != null) {
      declaredTeams.forEach(
          (division, names) ->
              names.forEach(
                  name ->
                      rosters
                          .computeIfAbsent(division, d -> new LinkedHashMap<>())
                          .computeIfAbsent(requireName(name), n -> new ArrayList<>())));
    }
    for (Player p : players) {
      p.teams()
          .forEach(
              (division, name) ->
                  rosters
                      .computeIfAbsent(division, d -> new LinkedHashMap<>())
                      .computeIfAbsent(name, n -> new ArrayList<>())
                      .add(p));
    }
    rosters.forEach(
        (division, byName) -> {
          Map<String, Team> resolved = teams.computeIfAbsent(division, d -> new LinkedHashMap<>());
          byName.forEach((name, roster) -> resolved.put(name, new Team(name, division, roster)));
        });
  }

  /**
   * Returns a team playing in the given division.
   *
   * @throws IllegalArgumentException if the division has no team of that name
   */
  public Team team(Division division, String name) {
    return find(division, requireName(name))
        .orElseThrow(
            () -> new IllegalArgumentException("Team " + name + " not found in division " + division.id()));
  }

  public Optional<Team> find(Division division, String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(teams.getOrDefault(division, Map.of()).get(name.trim()));
  }

  /**
   * Resolves a referee. Refereeing crosses divisions: the match's own division is searched first,
   * then every other one. An unknown name becomes a player-less team in the match's division.
   *
   * @return the referee team, or {@code null} for a blank name
   */
  public Team referee(String name, Division matchDivision) {
    if (name == null || name.isBlank()) return null;
    String trimmed = name.trim();
    Optional<Team> own = find(matchDivision, trimmed);
    if (own.isPresent()) return own.get();
    for (Map<String, Team> byName : teams.values()) {
      Team t = byName.get(trimmed);
      if (t != null) return t;
    }
    Team created = new Team(trimmed, matchDivision, List.of());
    teams.computeIfAbsent(matchDivision, d -> new LinkedHashMap<>()).put(trimmed, created);
    return created;
  }

  /**
   * Resolves a team staffing a setup or pack-down activity; blank names and the placeholder name map
   * to {@link Team#placeholder(Division)}.
   */
  public Team activityTeam(Division division, String name) {
    if (name == null || name.isBlank() || Team.PLACEHOLDER_NAME.equals(name.trim())) {
      return Team.placeholder(division);
    }
    return team(division, name);
  }

  /** All known teams, division by division. */
  public List<Team> teams() {
    List<Team> out = new ArrayList<>();
    teams.values().forEach(byName -> out.addAll(byName.values()));
    return out;
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Team name is required");
    return name.trim();
  }
}
