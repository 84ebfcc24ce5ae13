package com.gnovoa.tourney.runner;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public final class RunnerRegistry {

    private final Map<String, OptimizationRunner> runners = new ConcurrentHashMap<>();
    private final RunnerProperties props;

    public RunnerRegistry(RunnerProperties props) {
        this.props = props;
    }

    public void register(OptimizationRunner runner) {
        runners.put(runner.jobId(), runner);
        evictFinished();
    }

    public OptimizationRunner runner(String jobId) {
        OptimizationRunner r = runners.get(jobId);
        if (r == null) throw new UnknownJobException(jobId);
        return r;
    }

    public List<OptimizationRunner> all() {
        return new ArrayList<>(runners.values());
    }

    private synchronized void evictFinished() {
        List<OptimizationRunner> finished = runners.values().stream()
                .filter(r -> r.status().state().isFinished())
                .sorted((a, b) -> a.status().finishedAt().compareTo(b.status().finishedAt()))
                .toList();
        int excess = finished.size() - props.maxRetainedJobs();
        for (int i = 0; i < excess; i++) runners.remove(finished.get(i).jobId());
    }
}
