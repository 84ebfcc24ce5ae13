package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.optimize.StrategyId;

import java.time.Instant;

public record RunnerStatus(
        String jobId,
        StrategyId strategy,
        RunnerState state,
        int iterations,
        int iteration,
        double progress,
        Integer initialScore,
        Integer currentScore,
        Integer bestScore,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String error
) {}
