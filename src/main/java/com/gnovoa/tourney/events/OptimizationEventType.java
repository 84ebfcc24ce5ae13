package com.gnovoa.tourney.events;

public enum OptimizationEventType {
    STARTED,
    PROGRESS,
    IMPROVED,
    FINISHED,
    CANCELLED,
    FAILED
}
