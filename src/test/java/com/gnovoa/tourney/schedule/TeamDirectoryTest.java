package com.gnovoa.tourney.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.Team;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TeamDirectoryTest {

  private TeamDirectory directory;

  @BeforeEach
  void setUp() {
    directory =
        new TeamDirectory(
            List.of(Player.of("Pat", "Alpha", "Gamma", null), Player.of("Alex", "Alpha", null, null)),
            Map.of(Division.CLOTH, List.of("Linen")));
  }

  @Test
  @DisplayName("Teams are built from player rosters")
  void teamsFromPlayers() {
    Team alpha = directory.team(Division.MIXED, "Alpha");

    assertThat(alpha.players()).extracting(Player::name).containsExactly("Pat", "Alex");
    assertThat(directory.team(Division.GENDERED, " Gamma ").hasPlayer("Pat")).isTrue();
    assertThat(directory.team(Division.CLOTH, "Linen").players()).isEmpty();
    assertThat(directory.teams()).hasSize(3);
  }

  @Test
  @DisplayName("Unknown teams are rejected")
  void unknownTeam() {
    assertThatThrownBy(() -> directory.team(Division.MIXED, "Gamma"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Gamma");
    assertThatThrownBy(() -> directory.team(Division.MIXED, " ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Referees are looked up across divisions and created when unknown")
  void referees() {
    assertThat(directory.referee("Gamma", Division.MIXED).division()).isEqualTo(Division.GENDERED);
    assertThat(directory.referee("Alpha", Division.MIXED)).isSameAs(directory.team(Division.MIXED, "Alpha"));
    assertThat(directory.referee("", Division.MIXED)).isNull();

    Team volunteers = directory.referee("Volunteers", Division.CLOTH);
    assertThat(volunteers.players()).isEmpty();
    assertThat(directory.find(Division.CLOTH, "Volunteers")).contains(volunteers);
  }

  @Test
  @DisplayName("Activity staff may be the placeholder")
  void activityTeams() {
    assertThat(directory.activityTeam(Division.MIXED, null).isPlaceholder()).isTrue();
    assertThat(directory.activityTeam(Division.MIXED, Team.PLACEHOLDER_NAME).isPlaceholder()).isTrue();
    assertThat(directory.activityTeam(Division.MIXED, "Alpha").name()).isEqualTo("Alpha");
  }
}
