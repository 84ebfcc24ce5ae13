package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.optimize.OptimizationStrategies;
import com.gnovoa.tourney.optimize.ScheduleOptimizer;
import com.gnovoa.tourney.optimize.StrategyId;
import com.gnovoa.tourney.out.EventPublisher;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

public final class OptimizationJobFactory {

    private final ScheduleOptimizer optimizer;
    private final OptimizationStrategies strategies;
    private final EventPublisher publisher;
    private final ExecutorService exec;

    public OptimizationJobFactory(ScheduleOptimizer optimizer, OptimizationStrategies strategies,
                                  EventPublisher publisher, ExecutorService exec) {
        this.optimizer = optimizer;
        this.strategies = strategies;
        this.publisher = publisher;
        this.exec = exec;
    }

    public OptimizationJob create(Schedule schedule, List<ScheduleRule> rules, int iterations, StrategyId strategy) {
        String jobId = "job-" + UUID.randomUUID();
        return new OptimizationJob(jobId, schedule, rules, iterations, strategy, optimizer,
                strategies.newRandomSource(), publisher, exec);
    }
}
