package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Annealing whose moves mostly target the highest-priority violations. A run of rejections raises the
 * temperature to climb out of a local optimum.
 */
public final class StrategicSwapStrategy implements OptimizationStrategy<StrategicSwapStrategy.Progress> {

    private static final Logger log = LoggerFactory.getLogger(StrategicSwapStrategy.class);

    private static final int MAX_CHAINED_SWAPS = 3;

    /** @param rejections consecutive rejected candidates */
    public record Progress(double temperature, int rejections) {}

    private final OptimizerProperties.Strategic props;
    private final RandomSource random;

    public StrategicSwapStrategy(OptimizerProperties.Strategic props, RandomSource random) {
        this.props = props;
        this.random = random;
    }

    @Override public StrategyId id() { return StrategyId.STRATEGIC; }

    @Override
    public Progress initialStorage(Schedule initial, List<? extends ScheduleRule> rules) {
        return new Progress(props.initialTemperature(), 0);
    }

    @Override
    public StepResult<Progress> step(OptimizationState<Progress> state, int iteration, List<? extends ScheduleRule> rules) {
        Schedule current = state.current();
        Schedule candidate = null;
        if (!current.violations().isEmpty() && random.nextDouble() < props.targetedProbability()) {
            candidate = targetedCandidate(current, rules);
        }
        if (candidate == null) {
            candidate = current.randomize(random);
            candidate.evaluate(rules);
        }

        double temperature = state.storage().temperature();
        boolean feasible = !Acceptance.breaksHardConstraints(candidate);
        boolean accepted = feasible && Acceptance.metropolis(current.score(), candidate.score(), temperature, random);

        int rejections = accepted ? 0 : state.storage().rejections() + 1;
        double nextTemperature = temperature * props.coolingRate();
        if (rejections >= props.rejectionThreshold()) {
            nextTemperature = Math.min(temperature * props.reheatFactor(), props.maxTemperature());
            log.debug("Iteration {}: {} rejections in a row, reheating to {}", iteration, rejections, nextTemperature);
            rejections = 0;
        }
        Progress next = new Progress(nextTemperature, rejections);

        Schedule best = feasible && candidate.score() < state.bestScore() ? candidate : null;
        return new StepResult<>(accepted ? candidate : null, best, next);
    }

    /**
     * Chains up to three targeted swaps, re-aiming after each one. If the result is worse than where it
     * started, one random swap is added on top.
     */
    private Schedule targetedCandidate(Schedule current, List<? extends ScheduleRule> rules) {
        Schedule candidate = current;
        int swaps = random.nextIntInclusive(1, MAX_CHAINED_SWAPS);
        for (int i = 0; i < swaps && !candidate.violations().isEmpty(); i++) {
            Optional<Schedule> next = StrategicSwap.targeted(candidate, random);
            if (next.isEmpty()) break;
            candidate = next.get();
            candidate.evaluate(rules);
        }
        if (candidate == current) return null;

        if (candidate.score() > current.score()) {
            Optional<Schedule> shaken = StrategicSwap.random(candidate, random);
            if (shaken.isPresent()) {
                candidate = shaken.get();
                candidate.evaluate(rules);
            }
        }
        return candidate;
    }
}
