package com.gnovoa.tourney.optimize;

import static com.gnovoa.tourney.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.optimize.GeneticAlgorithmStrategy.Population;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.random.SeededRandomSource;
import com.gnovoa.tourney.rules.AvoidBackToBackGames;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GeneticAlgorithmStrategyTest {

  private final List<ScheduleRule> noRules = List.of();

  private final OptimizerProperties.Genetic props = new OptimizerProperties.Genetic(4, 2, 2, 0.3, 0.5, 3);

  /** Always rolls the given value and the lowest integer. */
  private static RandomSource rolling(double value) {
    return new RandomSource() {
      @Override
      public int nextIntInclusive(int min, int max) {
        return min;
      }

      @Override
      public double nextDouble() {
        return value;
      }
    };
  }

  private static Schedule twoSlots() {
    return schedule(match(team("A"), team("B"), 1, "Field 1"), match(team("C"), team("D"), 2, "Field 1"));
  }

  private static List<Schedule> population(Schedule base) {
    base.evaluate(List.of());
    List<Schedule> members = new ArrayList<>();
    for (int i = 0; i < 4; i++) members.add(base.deepCopy());
    return members;
  }

  private static int slotOf(Schedule schedule, String team1) {
    return schedule.matches().stream()
        .filter(m -> m.team1().name().equals(team1))
        .findFirst()
        .orElseThrow()
        .timeSlot();
  }

  @Test
  @DisplayName("Elites carry over to the next generation unchanged")
  void elitesSurvive() {
    var strategy = new GeneticAlgorithmStrategy(props, new SeededRandomSource(8));
    List<Schedule> parents = population(twoSlots());

    StepResult<Population> result =
        strategy.step(new OptimizationState<>(parents.get(0), parents.get(0), new Population(parents, 0, 0)), 0, noRules);

    assertThat(result.storage().members()).hasSize(4).contains(parents.get(0), parents.get(1));
    assertThat(result.storage().members()).doesNotContain(parents.get(2), parents.get(3));
    assertThat(result.storage().stagnantGenerations()).isEqualTo(1);
  }

  @Test
  @DisplayName("Reaching the stagnation limit reseeds the non-elites and resets the counter")
  void stagnationReseeds() {
    var strategy = new GeneticAlgorithmStrategy(props, new SeededRandomSource(9));
    List<Schedule> parents = population(twoSlots());

    StepResult<Population> result =
        strategy.step(new OptimizationState<>(parents.get(0), parents.get(0), new Population(parents, 0, 2)), 5, noRules);

    assertThat(result.storage().stagnantGenerations()).isZero();
    assertThat(result.storage().bestScore()).isZero();
    assertThat(result.storage().members()).hasSize(4).contains(parents.get(0), parents.get(1));
  }

  @Test
  @DisplayName("Crossover copies the first parent when no division is drawn")
  void crossoverWithoutDivisions() {
    var strategy = new GeneticAlgorithmStrategy(props, rolling(0.99));
    Schedule first = twoSlots();
    Schedule second = first.deepCopy().swapMatches(first.matches().get(0), first.matches().get(1)).orElseThrow();

    Schedule child = strategy.crossover(first, second);

    assertThat(child).isNotSameAs(first);
    assertThat(slotOf(child, "A")).isEqualTo(1);
    assertThat(slotOf(child, "C")).isEqualTo(2);
  }

  @Test
  @DisplayName("Crossover takes a drawn division from the second parent")
  void crossoverTakesDivision() {
    var strategy = new GeneticAlgorithmStrategy(props, rolling(0.0));
    Schedule first = twoSlots();
    Schedule second = first.deepCopy().swapMatches(first.matches().get(0), first.matches().get(1)).orElseThrow();

    Schedule child = strategy.crossover(first, second);

    assertThat(slotOf(child, "A")).isEqualTo(2);
    assertThat(slotOf(child, "C")).isEqualTo(1);
  }

  @Test
  @DisplayName("Crossover falls back to the first parent when the second would drop a slot")
  void crossoverFallsBack() {
    var strategy = new GeneticAlgorithmStrategy(props, rolling(0.0));
    Schedule first = twoSlots();
    Schedule second = first.deepCopy();
    second.matches().get(1).setTimeSlot(1);
    second.matches().get(1).setField("Field 2");

    Schedule child = strategy.crossover(first, second);

    assertThat(child).isNotSameAs(first);
    assertThat(slotOf(child, "A")).isEqualTo(1);
    assertThat(slotOf(child, "C")).isEqualTo(2);
  }

  @Test
  @DisplayName("Members with critical violations rank behind clean ones whatever their score")
  void criticalRanksLast() {
    Schedule critical = lockedDoubleBooking();
    critical.evaluate(noRules);
    Team a = team("A");
    Schedule clean =
        schedule(match(a, team("B"), 1, "Field 1"), match(a, team("C"), 2, "Field 1"), match(a, team("D"), 3, "Field 1"));
    clean.evaluate(List.of(new AvoidBackToBackGames(10)));
    assertThat(clean.score()).isGreaterThanOrEqualTo(critical.score());

    List<Schedule> ranked = new ArrayList<>(List.of(critical, clean));
    ranked.sort(GeneticAlgorithmStrategy.BY_RANK);

    assertThat(ranked).containsExactly(clean, critical);
  }

  @Test
  @DisplayName("A generation whose leader breaks a hard constraint reports neither current nor best")
  void criticalLeaderNotReported() {
    var strategy = new GeneticAlgorithmStrategy(props, new SeededRandomSource(10));
    Schedule stuck = lockedDoubleBooking();
    stuck.evaluate(noRules);
    Population initial = strategy.initialStorage(stuck, noRules);

    StepResult<Population> result = strategy.step(new OptimizationState<>(stuck, stuck, initial), 0, noRules);

    assertThat(result.current()).isNull();
    assertThat(result.best()).isNull();
    assertThat(result.storage().members()).hasSize(4);
    assertThat(result.storage().bestScore()).isEqualTo(Integer.MAX_VALUE);
  }
}
