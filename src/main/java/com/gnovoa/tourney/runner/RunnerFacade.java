package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.api.ScheduleMapper;
import com.gnovoa.tourney.api.dto.JobResponse;
import com.gnovoa.tourney.api.dto.JobStatusResponse;
import com.gnovoa.tourney.optimize.StrategyId;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public final class RunnerFacade {

    private final RunnerRegistry registry;
    private final OptimizationJobFactory factory;
    private final RunnerProperties props;
    private final ScheduleMapper mapper;

    public RunnerFacade(RunnerRegistry registry, OptimizationJobFactory factory, RunnerProperties props, ScheduleMapper mapper) {
        this.registry = registry;
        this.factory = factory;
        this.props = props;
        this.mapper = mapper;
    }

    public JobResponse submit(Schedule schedule, List<ScheduleRule> rules, Integer iterations, StrategyId strategy) {
        int budget = iterations == null ? props.defaultIterations() : iterations;
        if (budget < 0 || budget > props.maxIterations()) {
            throw new IllegalArgumentException("iterations must be between 0 and " + props.maxIterations());
        }
        OptimizationJob job = factory.create(schedule, rules, budget, strategy);
        registry.register(job);
        job.start();
        return toResponse(job);
    }

    public JobStatusResponse status(String jobId) {
        OptimizationRunner runner = registry.runner(jobId);
        Schedule best = runner.bestSchedule();
        return new JobStatusResponse(runner.status(), best == null ? null : mapper.toResponse(best));
    }

    public JobResponse cancel(String jobId) {
        OptimizationRunner runner = registry.runner(jobId);
        runner.cancel();
        return toResponse(runner);
    }

    private JobResponse toResponse(OptimizationRunner runner) {
        String ws = "/ws/optimizations/" + runner.jobId();
        return new JobResponse(runner.jobId(), runner.status().state().name(), Map.of("job", ws));
    }
}
