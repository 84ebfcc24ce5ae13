package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.random.LocalRandomSource;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.random.SeededRandomSource;

/** Creates strategy instances from {@link StrategyId} and the configured tuning. */
public final class OptimizationStrategies {

    private final OptimizerProperties props;

    public OptimizationStrategies(OptimizerProperties props) {
        this.props = props == null ? OptimizerProperties.defaults() : props;
    }

    public OptimizationStrategy<?> create(StrategyId id, RandomSource random) {
        return switch (id) {
            case SIMULATED_ANNEALING -> new SimulatedAnnealingStrategy(props.annealing(), random);
            case GENETIC -> new GeneticAlgorithmStrategy(props.genetic(), random);
            case STRATEGIC -> new StrategicSwapStrategy(props.strategic(), random);
        };
    }

    /** Seeded when {@code optimizer.seed} is set, thread-local otherwise. */
    public RandomSource newRandomSource() {
        return props.seed() == null ? new LocalRandomSource() : new SeededRandomSource(props.seed());
    }

    public OptimizerProperties properties() {
        return props;
    }
}
