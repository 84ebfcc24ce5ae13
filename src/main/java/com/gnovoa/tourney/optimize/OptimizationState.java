package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.schedule.Schedule;

/**
 * What a strategy sees at each step. Both schedules are evaluated and must not be mutated.
 *
 * @param storage strategy-private state carried between steps
 */
public record OptimizationState<S>(Schedule current, Schedule best, S storage) {

    public int currentScore() { return current.score(); }

    public int bestScore() { return best.score(); }
}
