package com.gnovoa.tourney.runner;

import com.gnovoa.tourney.schedule.Schedule;

public interface OptimizationRunner {
    String jobId();
    RunnerStatus status();

    void start();
    void cancel();

    /** Best schedule so far (a snapshot), or null before the first progress report. */
    Schedule bestSchedule();
}
