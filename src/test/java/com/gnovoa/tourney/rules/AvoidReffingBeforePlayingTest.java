package com.gnovoa.tourney.rules;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AvoidReffingBeforePlayingTest {

  private final AvoidReffingBeforePlaying rule = new AvoidReffingBeforePlaying(3);

  @Test
  @DisplayName("Refereeing in the slot right before a game is a note")
  void refereeThenPlay() {
    Team c = team("C");
    var reffed = match(team("A"), team("B"), 1, "Field 1", c);
    var played = match(c, team("D"), 2, "Field 1");

    List<RuleViolation> violations = rule.evaluate(schedule(reffed, played));

    assertThat(violations).hasSize(1);
    assertThat(violations.get(0).description()).isEqualTo("Team C referees in slot 1 and plays in slot 2");
    assertThat(violations.get(0).level()).isEqualTo(ViolationLevel.NOTE);
    assertThat(violations.get(0).matches()).containsExactly(reffed, played);
  }

  @Test
  @DisplayName("Playing first and refereeing afterwards is fine")
  void playThenReferee() {
    Team c = team("C");
    var schedule = schedule(match(c, team("D"), 1, "Field 1"), match(team("A"), team("B"), 2, "Field 1", c));

    assertThat(rule.evaluate(schedule)).isEmpty();
  }

  @Test
  @DisplayName("A one-slot break between refereeing and playing is fine")
  void gapBetweenRefereeAndPlay() {
    Team c = team("C");
    var schedule = schedule(match(team("A"), team("B"), 1, "Field 1", c), match(c, team("D"), 3, "Field 1"));

    assertThat(rule.evaluate(schedule)).isEmpty();
  }
}
