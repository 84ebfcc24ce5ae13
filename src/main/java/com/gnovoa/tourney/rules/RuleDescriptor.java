package com.gnovoa.tourney.rules;

import java.util.Map;

public record RuleDescriptor(
        String id,
        String name,
        int priority,
        boolean enabled,
        Map<String, Double> parameters
) {}
