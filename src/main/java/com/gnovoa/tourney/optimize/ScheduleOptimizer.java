package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Drives a strategy for a fixed number of iterations and keeps the best schedule seen.
 *
 * <p>The loop is synchronous. Every {@code yieldEvery} iterations it reports progress and checks the
 * cancellation flag; a cancelled run returns the best schedule found so far. The input schedule is
 * never modified.
 */
public final class ScheduleOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleOptimizer.class);

    private final OptimizationStrategies strategies;

    public ScheduleOptimizer(OptimizationStrategies strategies) {
        this.strategies = Objects.requireNonNull(strategies, "strategies");
    }

    public Schedule optimize(Schedule schedule, List<? extends ScheduleRule> rules, int iterations,
                             ProgressObserver observer, StrategyId strategyId) {
        return optimize(schedule, rules, iterations, observer, strategyId, strategies.newRandomSource(), () -> false);
    }

    /**
     * @param observer receives periodic snapshots, one per improvement and a final one; may be null
     * @param cancelled polled at every yield point
     * @return the best schedule found, evaluated; never scores worse than the input
     */
    public Schedule optimize(Schedule schedule, List<? extends ScheduleRule> rules, int iterations,
                             ProgressObserver observer, StrategyId strategyId,
                             RandomSource random, BooleanSupplier cancelled) {
        if (iterations < 0) throw new IllegalArgumentException("iterations must not be negative");
        OptimizationStrategy<?> strategy = strategies.create(strategyId == null ? StrategyId.SIMULATED_ANNEALING : strategyId, random);
        return run(strategy, schedule, rules, iterations,
                observer == null ? ProgressObserver.NONE : observer,
                cancelled == null ? () -> false : cancelled);
    }

    private <S> Schedule run(OptimizationStrategy<S> strategy, Schedule schedule, List<? extends ScheduleRule> rules,
                             int iterations, ProgressObserver observer, BooleanSupplier cancelled) {
        int yieldEvery = strategies.properties().yieldEvery();

        Schedule current = schedule.deepCopy();
        current.evaluate(rules);
        Schedule best = current.deepCopy();
        int initialScore = best.score();
        S storage = strategy.initialStorage(current, rules);
        log.debug("Optimizing with {}: {} iterations, initial score {}", strategy.id().id(), iterations, initialScore);

        for (int i = 0; i < iterations; i++) {
            if (i % yieldEvery == 0) {
                emit(observer, i, iterations, current, best, false);
                if (cancelled.getAsBoolean()) {
                    log.info("Optimization cancelled at iteration {} with best score {}", i, best.score());
                    return best;
                }
            }

            StepResult<S> result = strategy.step(new OptimizationState<>(current, best, storage), i, rules);
            storage = result.storage();
            if (result.current() != null) current = result.current();

            Schedule candidate = better(result.current(), result.best());
            if (candidate != null && candidate.score() < best.score()) {
                best = candidate.deepCopy();
                emit(observer, i + 1, iterations, current, best, true);
            }
        }

        emit(observer, iterations, iterations, current, best, false);
        log.debug("Optimization finished: score {} -> {}", initialScore, best.score());
        return best;
    }

    private static Schedule better(Schedule a, Schedule b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.score() < a.score() ? b : a;
    }

    private static void emit(ProgressObserver observer, int iteration, int iterations,
                             Schedule current, Schedule best, boolean improved) {
        double progress = iterations == 0 ? 1.0 : (double) iteration / iterations;
        observer.onProgress(new OptimizationProgress(
                iteration, progress, current.score(), best.score(), best.violations(), best.deepCopy(), improved));
    }
}
