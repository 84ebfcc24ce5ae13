package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One step is one generation. Elites survive unchanged; the rest of the population is bred by
 * tournament selection, divisional crossover and mutation. Members with critical violations rank behind
 * every clean member and are never reported as current or best.
 */
public final class GeneticAlgorithmStrategy implements OptimizationStrategy<GeneticAlgorithmStrategy.Population> {

    private static final Logger log = LoggerFactory.getLogger(GeneticAlgorithmStrategy.class);

    /**
     * @param members evaluated schedules, best first
     * @param bestScore best score seen in any generation
     * @param stagnantGenerations generations since {@code bestScore} last improved
     */
    public record Population(List<Schedule> members, int bestScore, int stagnantGenerations) {
        public Population {
            members = List.copyOf(members);
        }
    }

    /** Schedules without critical violations first, then by score. */
    static final Comparator<Schedule> BY_RANK =
            Comparator.comparing(Schedule::hasCriticalViolation).thenComparingInt(Schedule::score);

    private final OptimizerProperties.Genetic props;
    private final RandomSource random;

    public GeneticAlgorithmStrategy(OptimizerProperties.Genetic props, RandomSource random) {
        this.props = props;
        this.random = random;
    }

    @Override public StrategyId id() { return StrategyId.GENETIC; }

    @Override
    public Population initialStorage(Schedule initial, List<? extends ScheduleRule> rules) {
        List<Schedule> members = new ArrayList<>();
        members.add(initial);
        while (members.size() < props.populationSize()) members.add(fresh(initial, rules));
        members.sort(BY_RANK);
        return new Population(members, feasibleScore(members.get(0)), 0);
    }

    @Override
    public StepResult<Population> step(OptimizationState<Population> state, int iteration, List<? extends ScheduleRule> rules) {
        List<Schedule> parents = state.storage().members();
        List<Schedule> next = new ArrayList<>(parents.subList(0, props.eliteCount()));

        while (next.size() < props.populationSize()) {
            Schedule child = crossover(select(parents), select(parents));
            child.evaluate(rules);
            if (random.nextDouble() < props.mutationRate()) {
                child = mutate(child);
                child.evaluate(rules);
            }
            next.add(child);
        }
        next.sort(BY_RANK);

        int generationBest = feasibleScore(next.get(0));
        int bestScore = state.storage().bestScore();
        int stagnant = state.storage().stagnantGenerations();
        if (generationBest < bestScore) {
            bestScore = generationBest;
            stagnant = 0;
        } else if (++stagnant >= props.stagnationLimit()) {
            log.debug("Generation {}: best score {} stagnant for {} generations, reseeding", iteration, bestScore, stagnant);
            Schedule seed = next.get(0);
            for (int i = props.eliteCount(); i < next.size(); i++) next.set(i, fresh(seed, rules));
            next.sort(BY_RANK);
            stagnant = 0;
        }

        Population population = new Population(next, bestScore, stagnant);
        Schedule leader = next.get(0);
        if (Acceptance.breaksHardConstraints(leader)) return StepResult.rejected(population);
        return new StepResult<>(leader, leader, population);
    }

    /** Score of a schedule that may be reported, or {@link Integer#MAX_VALUE} if it breaks a hard constraint. */
    private static int feasibleScore(Schedule schedule) {
        return Acceptance.breaksHardConstraints(schedule) ? Integer.MAX_VALUE : schedule.score();
    }

    private Schedule select(List<Schedule> population) {
        Schedule winner = null;
        for (int i = 0; i < props.tournamentSize(); i++) {
            Schedule contender = random.pick(population);
            if (winner == null || BY_RANK.compare(contender, winner) < 0) winner = contender;
        }
        return winner;
    }

    /**
     * Each division present in the first parent takes the second parent's slots and fields with
     * probability {@code crossoverRate}. Falls back to the first parent when that would drop a slot or
     * overfill one.
     */
    Schedule crossover(Schedule first, Schedule second) {
        Set<Division> present = EnumSet.noneOf(Division.class);
        for (Match m : first.matches()) if (m.isMovable()) present.add(m.division());

        Set<Division> fromSecond = EnumSet.noneOf(Division.class);
        for (Division d : present) {
            if (random.nextDouble() < props.crossoverRate()) fromSecond.add(d);
        }
        if (fromSecond.isEmpty()) return first.deepCopy();
        return first.withDivisionsFrom(second, fromSecond).orElseGet(first::deepCopy);
    }

    private Schedule mutate(Schedule child) {
        if (!child.violations().isEmpty()) {
            return StrategicSwap.targeted(child, random).orElseGet(() -> child.randomize(random));
        }
        return child.randomize(random);
    }

    private Schedule fresh(Schedule from, List<? extends ScheduleRule> rules) {
        Schedule s = from.randomize(random);
        s.evaluate(rules);
        return s;
    }
}
