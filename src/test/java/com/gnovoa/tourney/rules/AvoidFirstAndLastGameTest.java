package com.gnovoa.tourney.rules;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AvoidFirstAndLastGameTest {

  private final AvoidFirstAndLastGame rule = new AvoidFirstAndLastGame(4);

  @Test
  @DisplayName("A team doing setup and playing the last game is flagged once, its players suppressed")
  void setupTeamPlaysLast() {
    Team a = team("A");
    Team d = team("D");
    var setup = setup(a, Team.placeholder(Division.MIXED), 0);
    var last = match(a, d, 3, "Field 1");
    var schedule =
        schedule(setup, match(team("B"), team("C"), 1, "Field 1"), match(d, team("E"), 2, "Field 1"), last);

    List<RuleViolation> violations = rule.evaluate(schedule);

    assertThat(violations).hasSize(1);
    RuleViolation v = violations.get(0);
    assertThat(v.description())
        .isEqualTo(
            "Team A participates in both first period (setup + first game) and last period (last game + packdown) of the day");
    assertThat(v.level()).isEqualTo(ViolationLevel.ALERT);
    assertThat(v.matches()).containsExactly(setup, last);
  }

  @Test
  @DisplayName("A player whose two teams cover both ends of the day is reported")
  void playerOnTwoTeams() {
    Player pat = new Player("Pat", Map.of(Division.MIXED, "Alpha", Division.GENDERED, "Gamma"));
    Team alpha = teamWithPlayers("Alpha", Division.MIXED, pat);
    Team gamma = teamWithPlayers("Gamma", Division.GENDERED, pat);
    var schedule =
        schedule(
            match(alpha, team("Beta"), 1, "Field 1"),
            match(team("Delta"), team("Epsilon"), 2, "Field 1"),
            match(gamma, team("Zeta", Division.GENDERED), 3, "Field 1"));

    assertThat(rule.evaluate(schedule))
        .extracting(RuleViolation::description)
        .containsExactly(
            "Player Pat participates in both first period (setup + first game) and last period (last game + packdown) of the day");
  }

  @Test
  @DisplayName("Placeholder teams never count")
  void placeholderIgnored() {
    Team placeholder = Team.placeholder(Division.MIXED);
    var schedule =
        schedule(
            setup(placeholder, placeholder, 0),
            match(team("A"), team("B"), 1, "Field 1"),
            match(team("C"), team("D"), 2, "Field 1"),
            packDown(placeholder, placeholder, 3));

    assertThat(rule.evaluate(schedule)).isEmpty();
  }

  @Test
  @DisplayName("No regular games means no violations")
  void onlySpecialActivities() {
    Team a = team("A");
    var schedule = schedule(setup(a, a, 0), packDown(a, a, 1));

    assertThat(rule.evaluate(schedule)).isEmpty();
  }
}
