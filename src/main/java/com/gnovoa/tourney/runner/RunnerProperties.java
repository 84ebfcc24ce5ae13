package com.gnovoa.tourney.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param workerThreads optimizations that may run at once; further jobs queue
 * @param maxRetainedJobs finished jobs kept for status queries before the oldest are evicted
 */
@ConfigurationProperties(prefix = "runner")
public record RunnerProperties(
        int workerThreads,
        int defaultIterations,
        int maxIterations,
        int maxRetainedJobs
) {
    public RunnerProperties {
        if (workerThreads <= 0) workerThreads = 2;
        if (defaultIterations <= 0) defaultIterations = 10_000;
        if (maxIterations <= 0) maxIterations = 200_000;
        if (maxRetainedJobs <= 0) maxRetainedJobs = 100;
    }
}
