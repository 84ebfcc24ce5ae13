package com.gnovoa.tourney.optimize;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Search tuning under {@code optimizer.*}. Zero or missing values fall back to the defaults.
 *
 * @param yieldEvery iterations between progress snapshots and cancellation checks
 * @param seed fixed seed for reproducible runs; {@code null} draws from a thread-local source
 */
@ConfigurationProperties(prefix = "optimizer")
public record OptimizerProperties(
        int yieldEvery,
        Long seed,
        Annealing annealing,
        Genetic genetic,
        Strategic strategic
) {

    public OptimizerProperties {
        if (yieldEvery <= 0) yieldEvery = 100;
        if (annealing == null) annealing = new Annealing(0, 0);
        if (genetic == null) genetic = new Genetic(0, 0, 0, 0, 0, 0);
        if (strategic == null) strategic = new Strategic(0, 0, 0, 0, 0, 0);
    }

    public static OptimizerProperties defaults() {
        return new OptimizerProperties(0, null, null, null, null);
    }

    public OptimizerProperties withSeed(Long seed) {
        return new OptimizerProperties(yieldEvery, seed, annealing, genetic, strategic);
    }

    public record Annealing(double initialTemperature, double coolingRate) {
        public Annealing {
            if (initialTemperature <= 0) initialTemperature = 150;
            if (coolingRate <= 0 || coolingRate >= 1) coolingRate = 0.995;
        }
    }

    public record Genetic(
            int populationSize,
            int eliteCount,
            int tournamentSize,
            double mutationRate,
            double crossoverRate,
            int stagnationLimit
    ) {
        public Genetic {
            if (populationSize < 2) populationSize = 20;
            if (eliteCount <= 0 || eliteCount >= populationSize) eliteCount = Math.min(2, populationSize - 1);
            if (tournamentSize <= 0) tournamentSize = 3;
            if (mutationRate <= 0 || mutationRate > 1) mutationRate = 0.3;
            if (crossoverRate <= 0 || crossoverRate > 1) crossoverRate = 0.5;
            if (stagnationLimit <= 0) stagnationLimit = 15;
        }
    }

    /**
     * @param targetedProbability share of steps that swap matches named by a top-priority violation
     * @param rejectionThreshold consecutive rejections before the temperature is raised
     * @param reheatFactor temperature multiplier applied after the threshold
     * @param maxTemperature ceiling for reheating
     */
    public record Strategic(
            double targetedProbability,
            double initialTemperature,
            double coolingRate,
            int rejectionThreshold,
            double reheatFactor,
            double maxTemperature
    ) {
        public Strategic {
            if (targetedProbability <= 0 || targetedProbability > 1) targetedProbability = 0.8;
            if (initialTemperature <= 0) initialTemperature = 100;
            if (coolingRate <= 0 || coolingRate >= 1) coolingRate = 0.997;
            if (rejectionThreshold <= 0) rejectionThreshold = 50;
            if (reheatFactor <= 1) reheatFactor = 1.5;
            if (maxTemperature <= 0) maxTemperature = 200;
        }
    }
}
