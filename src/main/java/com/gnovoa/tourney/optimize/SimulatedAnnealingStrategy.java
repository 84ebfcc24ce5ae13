package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;

public final class SimulatedAnnealingStrategy implements OptimizationStrategy<SimulatedAnnealingStrategy.Temperature> {

    public record Temperature(double value) {}

    private final OptimizerProperties.Annealing props;
    private final RandomSource random;

    public SimulatedAnnealingStrategy(OptimizerProperties.Annealing props, RandomSource random) {
        this.props = props;
        this.random = random;
    }

    @Override public StrategyId id() { return StrategyId.SIMULATED_ANNEALING; }

    @Override
    public Temperature initialStorage(Schedule initial, List<? extends ScheduleRule> rules) {
        return new Temperature(props.initialTemperature());
    }

    @Override
    public StepResult<Temperature> step(OptimizationState<Temperature> state, int iteration, List<? extends ScheduleRule> rules) {
        double temperature = state.storage().value();
        Temperature cooled = new Temperature(temperature * props.coolingRate());

        Schedule candidate = state.current().randomize(random);
        candidate.evaluate(rules);
        if (Acceptance.breaksHardConstraints(candidate)) return StepResult.rejected(cooled);

        Schedule best = candidate.score() < state.bestScore() ? candidate : null;
        if (Acceptance.metropolis(state.currentScore(), candidate.score(), temperature, random)) {
            return new StepResult<>(candidate, best, cooled);
        }
        return new StepResult<>(null, best, cooled);
    }
}
