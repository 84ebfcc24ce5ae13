package com.gnovoa.tourney.rules;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SupplementaryRulesTest {

  @Test
  @DisplayName("Players over the game cap and uneven divisions are reported")
  void playerGameBalance() {
    Team a = team("A");
    var schedule =
        schedule(
            match(a, team("B"), 1, "Field 1"),
            match(a, team("C"), 3, "Field 1"),
            match(a, team("D"), 5, "Field 1"));

    assertThat(new ManagePlayerGameBalance(1, 2, 1).evaluate(schedule))
        .extracting(RuleViolation::description)
        .containsExactlyInAnyOrder(
            "Player A Player 1 is scheduled for 3 games (max: 2)",
            "Player A Player 2 is scheduled for 3 games (max: 2)",
            "Game distribution imbalance in mixed: 1-3 games (max difference: 1)");
  }

  @Test
  @DisplayName("Players starting in the first slot have no warm-up")
  void warmup() {
    var schedule =
        schedule(match(team("A"), team("B"), 1, "Field 1"), match(team("C"), team("D"), 2, "Field 1"));

    List<RuleViolation> violations = new EnsurePlayerWarmupTime(1, 1).evaluate(schedule);

    assertThat(violations).hasSize(4).allSatisfy(v -> assertThat(v.level()).isEqualTo(ViolationLevel.NOTE));
    assertThat(violations)
        .extracting(RuleViolation::description)
        .contains("Player A Player 1 has first game in slot 1 (needs 1 warm-up slots)")
        .noneMatch(d -> d.startsWith("Player C"));
  }

  @Test
  @DisplayName("Uneven referee duty is reported once")
  void refereeBalance() {
    Team c = team("C");
    Team d = team("D");
    var schedule =
        schedule(
            match(team("A"), team("B"), 1, "Field 1", c),
            match(team("E"), team("F"), 2, "Field 1", c),
            match(team("G"), team("H"), 3, "Field 1", c),
            match(team("I"), team("J"), 4, "Field 1", d));

    assertThat(new BalanceRefereeAssignments(3, 1).evaluate(schedule))
        .extracting(RuleViolation::description)
        .containsExactly("Referee assignment imbalance: 1-3 assignments (max difference: 1)");
  }

  @Test
  @DisplayName("Two divisions sharing a slot are reported")
  void mixedDivisions() {
    var schedule =
        schedule(
            match(team("A"), team("B"), 1, "Field 1"),
            match(team("G1", Division.GENDERED), team("G2", Division.GENDERED), 1, "Field 2"),
            match(team("C"), team("D"), 2, "Field 1"));

    assertThat(new DetectMixedDivisionsInTimeSlot(1).evaluate(schedule))
        .extracting(RuleViolation::description)
        .containsExactly("Time slot 1 has multiple divisions: mixed, gendered");
  }

  @Test
  @DisplayName("Refereeing while a club mate plays is reported")
  void clubConflict() {
    var schedule =
        schedule(
            match(team("Owls Blue"), team("Emus Gold"), 1, "Field 1", team("Hawks Green")),
            match(team("Hawks Red"), team("Kites Grey"), 1, "Field 2"));

    assertThat(new PreventClubRefereeConflict(1).evaluate(schedule))
        .extracting(RuleViolation::description)
        .containsExactly("Team Hawks Green is refereeing in slot 1 while club team (Hawks Red) is playing in the same slot");
  }

  @Test
  @DisplayName("The club is the first word of the team name")
  void clubName() {
    assertThat(PreventClubRefereeConflict.clubOf("  Hawks Red ")).isEqualTo("Hawks");
    assertThat(PreventClubRefereeConflict.clubOf("Solo")).isEqualTo("Solo");
  }

  @Test
  @DisplayName("Custom rules contribute their priority to the score")
  void customRule() {
    var schedule = schedule(match(team("A"), team("B"), 1, "Field 1"));
    var rule =
        new CustomRule(
            "No games in slot 1",
            7,
            s ->
                s.matches().stream()
                    .filter(m -> m.timeSlot() == 1)
                    .map(m -> new RuleViolation("No games in slot 1", "Game in slot 1", List.of(m), ViolationLevel.NOTE))
                    .toList());

    assertThat(schedule.evaluate(List.of(rule))).isEqualTo(7);
    assertThat(schedule.violations()).singleElement().satisfies(v -> assertThat(v.priority()).isEqualTo(7));
  }

  @Test
  @DisplayName("Priorities below one are rejected")
  void invalidPriority() {
    assertThatThrownBy(() -> new DetectMixedDivisionsInTimeSlot(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
