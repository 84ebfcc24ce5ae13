package com.gnovoa.tourney.schedule;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.random.SeededRandomSource;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RefereeAssignerTest {

  @Test
  @DisplayName("Referees never play or referee elsewhere in the same slot")
  void refereesAreFree() {
    for (long seed = 0; seed < 20; seed++) {
      Schedule day = tournamentDay();
      List<Match> matches = new ArrayList<>(day.matches());

      new RefereeAssigner(new SeededRandomSource(seed)).reassign(matches);

      ScheduleRandomizerTest.MatchGroupsAssert.assertRefereesAvailable(new Schedule(matches));
      assertThat(matches.stream().filter(Match::isRegular)).allSatisfy(m -> assertThat(m.refereeTeam()).isNotNull());
    }
  }

  @Test
  @DisplayName("A match is left without referee when nobody is free")
  void noEligibleReferee() {
    Team c = team("C");
    Match first = match(team("A"), team("B"), 1, "Field 1", c);
    Match second = match(c, team("D"), 1, "Field 2", team("E"));
    List<Match> matches = new ArrayList<>(List.of(first, second));

    new RefereeAssigner(new SeededRandomSource(5)).reassign(matches);

    assertThat(first.refereeTeam()).isEqualTo(team("E"));
    assertThat(second.refereeTeam()).isNull();
  }

  @Test
  @DisplayName("Divisions without referees keep their matches unrefereed")
  void emptyPool() {
    Match only = match(team("A"), team("B"), 1, "Field 1");
    List<Match> matches = new ArrayList<>(List.of(only));

    new RefereeAssigner(new SeededRandomSource(5)).reassign(matches);

    assertThat(only.refereeTeam()).isNull();
  }
}
