package com.gnovoa.tourney.events;

import com.gnovoa.tourney.optimize.StrategyId;

import java.time.Instant;
import java.util.Map;

public record OptimizationEvent(
        String jobId,
        StrategyId strategy,
        Instant occurredAt,
        OptimizationEventType type,
        int iteration,
        double progress,
        int currentScore,
        int bestScore,
        int violationCount,
        Map<String, Object> data
) {}
