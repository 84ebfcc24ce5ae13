package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;

/**
 * Snapshot handed to a {@link ProgressObserver}.
 *
 * @param progress completed share of the iteration budget, 0 to 1
 * @param violations violations of the best schedule
 * @param bestScheduleSnapshot independent copy of the best schedule
 * @param improved whether this snapshot was triggered by a new best score
 */
public record OptimizationProgress(
        int iteration,
        double progress,
        int currentScore,
        int bestScore,
        List<RuleViolation> violations,
        Schedule bestScheduleSnapshot,
        boolean improved
) {}
