package com.gnovoa.tourney.optimize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StrategyId {
    SIMULATED_ANNEALING("simulated-annealing", "Simulated annealing",
            "Random perturbations accepted by the Metropolis criterion under a cooling temperature"),
    GENETIC("genetic", "Genetic algorithm",
            "Population of schedules evolved by tournament selection, divisional crossover and mutation"),
    STRATEGIC("strategic", "Strategic search",
            "Swaps matches named by the highest-priority violations, reheating when stuck");

    private final String id;
    private final String displayName;
    private final String description;

    StrategyId(String id, String displayName, String description) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String id() { return id; }
    public String displayName() { return displayName; }
    public String description() { return description; }

    @JsonCreator
    public static StrategyId fromId(String value) {
        if (value == null || value.isBlank()) return SIMULATED_ANNEALING;
        for (StrategyId s : values()) {
            if (s.id.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown strategy " + value);
    }
}
