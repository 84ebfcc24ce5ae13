package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.schedule.Schedule;

/**
 * Outcome of one strategy step.
 *
 * @param current new current schedule (evaluated), or {@code null} to keep the old one
 * @param best candidate for best-so-far (evaluated), or {@code null}; only taken if strictly better
 * @param storage storage for the next step
 */
public record StepResult<S>(Schedule current, Schedule best, S storage) {

    public static <S> StepResult<S> rejected(S storage) {
        return new StepResult<>(null, null, storage);
    }

    public static <S> StepResult<S> accepted(Schedule current, S storage) {
        return new StepResult<>(current, null, storage);
    }
}
