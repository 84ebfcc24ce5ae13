package com.gnovoa.tourney.optimize;

@FunctionalInterface
public interface ProgressObserver {

    ProgressObserver NONE = progress -> { };

    void onProgress(OptimizationProgress progress);
}
