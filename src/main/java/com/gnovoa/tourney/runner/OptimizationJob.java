package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.events.OptimizationEvent;
import com.gnovoa.tourney.events.OptimizationEventType;
import com.gnovoa.tourney.optimize.OptimizationProgress;
import com.gnovoa.tourney.optimize.ScheduleOptimizer;
import com.gnovoa.tourney.optimize.StrategyId;
import com.gnovoa.tourney.out.EventPublisher;
import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.rules.ScheduleRule;
import com.gnovoa.tourney.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One optimization run on the shared worker pool. Cancellation is cooperative: the optimizer sees the
 * flag at its next yield point and returns the best schedule found so far.
 */
public final class OptimizationJob implements OptimizationRunner {

    private static final Logger log = LoggerFactory.getLogger(OptimizationJob.class);

    private final String jobId;
    private final Schedule input;
    private final List<ScheduleRule> rules;
    private final int iterations;
    private final StrategyId strategy;
    private final ScheduleOptimizer optimizer;
    private final RandomSource random;
    private final EventPublisher publisher;
    private final ExecutorService exec;

    private final Instant createdAt = Instant.now();
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    private volatile RunnerState state = RunnerState.QUEUED;
    private volatile boolean cancelRequested = false;
    private volatile Future<?> task;

    private volatile OptimizationProgress latest;
    private volatile Schedule best;
    private volatile Integer initialScore;
    private volatile String error;

    OptimizationJob(String jobId, Schedule input, List<ScheduleRule> rules, int iterations, StrategyId strategy,
                    ScheduleOptimizer optimizer, RandomSource random, EventPublisher publisher, ExecutorService exec) {
        this.jobId = jobId;
        this.input = input;
        this.rules = List.copyOf(rules);
        this.iterations = iterations;
        this.strategy = strategy;
        this.optimizer = optimizer;
        this.random = random;
        this.publisher = publisher;
        this.exec = exec;
    }

    @Override public String jobId() { return jobId; }

    @Override public Schedule bestSchedule() { return best; }

    @Override
    public synchronized void start() {
        if (state != RunnerState.QUEUED || task != null) return;
        task = exec.submit(this::run);
    }

    @Override
    public synchronized void cancel() {
        cancelRequested = true;
        if (state == RunnerState.QUEUED) {
            if (task != null) task.cancel(false);
            finish(RunnerState.CANCELLED);
            publish(OptimizationEventType.CANCELLED, latest, Map.of("reason", "cancelled before start"));
        }
        // a running job switches to CANCELLED at its next yield point
    }

    @Override
    public synchronized RunnerStatus status() {
        OptimizationProgress p = latest;
        return new RunnerStatus(
                jobId,
                strategy,
                state,
                iterations,
                p == null ? 0 : p.iteration(),
                p == null ? 0.0 : p.progress(),
                initialScore,
                p == null ? null : p.currentScore(),
                p == null ? null : p.bestScore(),
                createdAt,
                startedAt,
                finishedAt,
                error
        );
    }

    private void run() {
        synchronized (this) {
            if (state != RunnerState.QUEUED) return;
            state = RunnerState.RUNNING;
            startedAt = Instant.now();
        }
        log.info("Job {} started: {} for {} iterations over {} matches", jobId, strategy.id(), iterations, input.matches().size());
        publish(OptimizationEventType.STARTED, null, Map.of("matches", input.matches().size(), "iterations", iterations));

        try {
            Schedule result = optimizer.optimize(input, rules, iterations, this::onProgress, strategy, random,
                    () -> cancelRequested);
            synchronized (this) {
                best = result;
                finish(cancelRequested ? RunnerState.CANCELLED : RunnerState.DONE);
            }
            log.info("Job {} {} with best score {} (initial {})", jobId, state, result.score(), initialScore);
            publish(state == RunnerState.CANCELLED ? OptimizationEventType.CANCELLED : OptimizationEventType.FINISHED,
                    latest, Map.of("bestScore", result.score()));
        } catch (RuntimeException e) {
            log.error("Job {} failed", jobId, e);
            synchronized (this) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                finish(RunnerState.FAILED);
            }
            publish(OptimizationEventType.FAILED, latest, Map.of("error", error));
        }
    }

    private void onProgress(OptimizationProgress progress) {
        if (initialScore == null) initialScore = progress.bestScore();
        latest = progress;
        best = progress.bestScheduleSnapshot();
        if (progress.improved()) {
            log.info("Job {} iteration {}: best score {}", jobId, progress.iteration(), progress.bestScore());
        }
        publish(progress.improved() ? OptimizationEventType.IMPROVED : OptimizationEventType.PROGRESS, progress, Map.of());
    }

    private void finish(RunnerState terminal) {
        state = terminal;
        finishedAt = Instant.now();
    }

    private void publish(OptimizationEventType type, OptimizationProgress p, Map<String, Object> data) {
        publisher.publish(new OptimizationEvent(
                jobId,
                strategy,
                Instant.now(),
                type,
                p == null ? 0 : p.iteration(),
                p == null ? 0.0 : p.progress(),
                p == null ? 0 : p.currentScore(),
                p == null ? 0 : p.bestScore(),
                p == null ? 0 : p.violations().size(),
                data
        ));
    }
}
