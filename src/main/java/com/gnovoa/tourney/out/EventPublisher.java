package com.gnovoa.tourney.out;

import com.gnovoa.tourney.events.OptimizationEvent;

public interface EventPublisher {
    void publish(OptimizationEvent event);
}
