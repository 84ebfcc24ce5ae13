package com.gnovoa.tourney.schedule;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.rules.AvoidBackToBackGames;
import com.gnovoa.tourney.rules.HardConstraintCheck;
import com.gnovoa.tourney.rules.RuleCatalog;
import com.gnovoa.tourney.rules.RuleProperties;
import com.gnovoa.tourney.rules.ScheduleRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScheduleTest {

  private final List<ScheduleRule> allRules = new RuleCatalog(RuleProperties.defaults()).enabledRules();

  @Test
  @DisplayName("The score is the sum of violation priorities, hard findings first")
  void scoreIsSumOfPriorities() {
    Team a = team("A");
    var schedule =
        schedule(
            match(a, team("B"), 1, "Field 1"),
            match(a, team("C"), 2, "Field 1"),
            match(team("D"), team("E"), 2, "Field 1"));

    int score = schedule.evaluate(List.of(new AvoidBackToBackGames(5)));

    assertThat(score).isEqualTo(15).isEqualTo(schedule.score());
    assertThat(schedule.violations())
        .extracting(RuleViolation::rule)
        .containsExactly(HardConstraintCheck.NAME, AvoidBackToBackGames.NAME);
    assertThat(schedule.hasCriticalViolation()).isTrue();
    assertThat(schedule.violations().stream().mapToInt(RuleViolation::priority).sum()).isEqualTo(score);
  }

  @Test
  @DisplayName("Each hard finding is reported once when evaluated with the full catalog")
  void hardFindingsReportedOnce() {
    Team a = team("A");
    var schedule = schedule(match(a, team("B"), 1, "Field 1"), match(a, team("C"), 1, "Field 2"));

    schedule.evaluate(allRules);

    assertThat(schedule.violations())
        .filteredOn(v -> v.rule().equals(HardConstraintCheck.NAME))
        .extracting(RuleViolation::description)
        .containsExactly("Team A has 2 assignments in slot 1");
  }

  @Test
  @DisplayName("Evaluation is deterministic")
  void deterministic() {
    Schedule schedule = tournamentDay();

    int first = schedule.evaluate(allRules);
    List<String> firstDescriptions = schedule.violations().stream().map(RuleViolation::description).toList();
    int second = schedule.evaluate(allRules);

    assertThat(second).isEqualTo(first);
    assertThat(schedule.violations()).extracting(RuleViolation::description).isEqualTo(firstDescriptions);
  }

  @Test
  @DisplayName("Evaluation orders matches by time slot")
  void sortsBySlot() {
    var schedule =
        schedule(match(team("A"), team("B"), 3, "Field 1"), match(team("C"), team("D"), 1, "Field 1"));

    schedule.evaluate(List.of());

    assertThat(schedule.matches()).extracting(Match::timeSlot).containsExactly(1, 3);
    assertThat(schedule.score()).isZero();
  }

  @Test
  @DisplayName("A deep copy is independent and its violations point at its own matches")
  void deepCopyIsolation() {
    Schedule original = tournamentDay();
    original.evaluate(allRules);

    Schedule copy = original.deepCopy();
    Match copied = copy.matches().stream().filter(Match::isMovable).findFirst().orElseThrow();
    copied.setTimeSlot(42);

    assertThat(original.matches()).extracting(Match::timeSlot).doesNotContain(42);
    assertThat(copy.score()).isEqualTo(original.score());
    assertThat(copy.violations()).hasSameSizeAs(original.violations());
    for (RuleViolation v : copy.violations()) {
      for (Match m : v.matches()) {
        assertThat(copy.matches()).anySatisfy(own -> assertThat(own).isSameAs(m));
        assertThat(original.matches()).noneSatisfy(other -> assertThat(other).isSameAs(m));
      }
    }
  }

  @Test
  @DisplayName("Copies keep match ids")
  void copiesKeepIds() {
    Schedule original = tournamentDay();

    assertThat(original.deepCopy().matches())
        .extracting(Match::matchId)
        .containsExactlyElementsOf(original.matches().stream().map(Match::matchId).toList());
  }

  @Test
  @DisplayName("Special activities are always locked")
  void specialsLocked() {
    Team placeholder = Team.placeholder(Division.MIXED);
    Match setup = new Match(placeholder, placeholder, 0, "", Division.MIXED, null, ActivityType.SETUP, false);

    assertThat(setup.locked()).isTrue();
    assertThat(setup.isMovable()).isFalse();
  }

  @Test
  @DisplayName("Slots and fields are read from the matches")
  void slotsAndFields() {
    Schedule day = tournamentDay();

    assertThat(day.timeSlots()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
    assertThat(day.regularTimeSlots()).containsExactly(1, 2, 3, 4, 5, 6);
    assertThat(day.fieldPool()).containsExactly("Field 1", "Field 2");
  }
}
