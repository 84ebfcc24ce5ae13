package com.gnovoa.tourney.api;

import com.gnovoa.tourney.api.dto.EvaluationResponse;
import com.gnovoa.tourney.api.dto.JobResponse;
import com.gnovoa.tourney.api.dto.JobStatusResponse;
import com.gnovoa.tourney.api.dto.OptimizationRequest;
import com.gnovoa.tourney.api.dto.ScheduleRequest;
import com.gnovoa.tourney.api.dto.StrategyResponse;
import com.gnovoa.tourney.optimize.StrategyId;
import com.gnovoa.tourney.rules.RuleCatalog;
import com.gnovoa.tourney.rules.RuleDescriptor;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.runner.RunnerFacade;
import com.gnovoa.tourney.schedule.Schedule;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api")
public class OptimizationController {

    private final RunnerFacade facade;
    private final ScheduleMapper mapper;
    private final RuleCatalog rules;

    public OptimizationController(RunnerFacade facade, ScheduleMapper mapper, RuleCatalog rules) {
        this.facade = facade;
        this.mapper = mapper;
        this.rules = rules;
    }

    @PostMapping("/schedules/evaluate")
    public EvaluationResponse evaluate(@RequestBody ScheduleRequest request) {
        Schedule schedule = mapper.toSchedule(request);
        schedule.evaluate(rules.rules(request.ruleIds()));
        return mapper.toResponse(schedule);
    }

    @PostMapping("/optimizations")
    public ResponseEntity<JobResponse> optimize(@RequestBody OptimizationRequest request) {
        if (request.schedule() == null) throw new IllegalArgumentException("schedule is required");
        Schedule schedule = mapper.toSchedule(request.schedule());
        List<ScheduleRule> selected = rules.rules(request.schedule().ruleIds());
        StrategyId strategy = StrategyId.fromId(request.strategy());
        return ResponseEntity.accepted().body(facade.submit(schedule, selected, request.iterations(), strategy));
    }

    @GetMapping("/optimizations/{jobId}")
    public JobStatusResponse status(@PathVariable String jobId) {
        return facade.status(jobId);
    }

    @PostMapping("/optimizations/{jobId}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable String jobId) {
        return ResponseEntity.accepted().body(facade.cancel(jobId));
    }

    @GetMapping("/rules")
    public List<RuleDescriptor> rules() {
        return rules.describe();
    }

    @GetMapping("/strategies")
    public List<StrategyResponse> strategies() {
        return Arrays.stream(StrategyId.values())
                .map(s -> new StrategyResponse(s.id(), s.displayName(), s.description()))
                .toList();
    }
}
