package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;

/**
 * One search algorithm. A strategy is a step function over {@link OptimizationState}; whatever it needs
 * between steps lives in its storage type {@code S}.
 */
public interface OptimizationStrategy<S> {

    StrategyId id();

    /** @param initial the evaluated starting schedule */
    S initialStorage(Schedule initial, List<? extends ScheduleRule> rules);

    StepResult<S> step(OptimizationState<S> state, int iteration, List<? extends ScheduleRule> rules);
}
