package com.gnovoa.tourney;

import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Builders shared by the tests. Every team gets two players named "{team} Player 1" and "{team} Player 2". */
public final class TestFixtures {

  private TestFixtures() {}

  public static Team team(String name) {
    return team(name, Division.MIXED);
  }

  public static Team team(String name, Division division) {
    return new Team(
        name,
        division,
        List.of(player(name + " Player 1", division, name), player(name + " Player 2", division, name)));
  }

  public static Team teamWithPlayers(String name, Division division, Player... players) {
    return new Team(name, division, List.of(players));
  }

  public static Player player(String name, Division division, String team) {
    return new Player(name, Map.of(division, team));
  }

  public static Match match(Team team1, Team team2, int slot, String field) {
    return new Match(team1, team2, slot, field, team1.division(), null);
  }

  public static Match match(Team team1, Team team2, int slot, String field, Team referee) {
    return new Match(team1, team2, slot, field, team1.division(), referee);
  }

  public static Match locked(Team team1, Team team2, int slot, String field, Team referee) {
    return new Match(team1, team2, slot, field, team1.division(), referee, ActivityType.REGULAR, true);
  }

  public static Match setup(Team team1, Team team2, int slot) {
    return new Match(team1, team2, slot, "Clubhouse", team1.division(), null, ActivityType.SETUP, true);
  }

  public static Match packDown(Team team1, Team team2, int slot) {
    return new Match(team1, team2, slot, "Clubhouse", team1.division(), null, ActivityType.PACKING_DOWN, true);
  }

  public static Schedule schedule(Match... matches) {
    return new Schedule(List.of(matches));
  }

  /**
   * A small two-division day on two fields: setup in slot 0, six mixed games in slots 1-3, three
   * gendered games in slots 4-6 and pack-down in slot 7. Referees come from the same division.
   */
  public static Schedule tournamentDay() {
    Team m1 = team("Mixed 1");
    Team m2 = team("Mixed 2");
    Team m3 = team("Mixed 3");
    Team m4 = team("Mixed 4");
    Team m5 = team("Mixed 5");
    Team m6 = team("Mixed 6");
    Team g1 = team("Gendered 1", Division.GENDERED);
    Team g2 = team("Gendered 2", Division.GENDERED);
    Team g3 = team("Gendered 3", Division.GENDERED);
    Team g4 = team("Gendered 4", Division.GENDERED);

    List<Match> matches = new ArrayList<>();
    matches.add(setup(m1, Team.placeholder(Division.MIXED), 0));
    matches.add(match(m1, m2, 1, "Field 1", m5));
    matches.add(match(m3, m4, 1, "Field 2", m6));
    matches.add(match(m1, m3, 2, "Field 1", m2));
    matches.add(match(m5, m6, 2, "Field 2", m4));
    matches.add(match(m2, m4, 3, "Field 1", m5));
    matches.add(match(m1, m6, 3, "Field 2", m3));
    matches.add(match(g1, g2, 4, "Field 1", g3));
    matches.add(match(g3, g4, 5, "Field 1", g1));
    matches.add(match(g1, g3, 6, "Field 2", g2));
    matches.add(packDown(g4, Team.placeholder(Division.GENDERED), 7));
    return new Schedule(matches);
  }

  /**
   * Team A is booked twice in slot 1 by two locked matches; no move can clear it. Two movable matches
   * fill slots 2 and 3.
   */
  public static Schedule lockedDoubleBooking() {
    Team a = team("A");
    return schedule(
        locked(a, team("B"), 1, "Field 1", null),
        locked(a, team("C"), 1, "Field 2", null),
        match(team("D"), team("E"), 2, "Field 1"),
        match(team("F"), team("G"), 3, "Field 1"));
  }
}
