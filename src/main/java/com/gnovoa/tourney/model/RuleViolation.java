package com.gnovoa.tourney.model;

import java.util.List;

/**
 * A single finding produced while evaluating a schedule.
 *
 * @param rule name of the rule that produced it
 * @param description human-readable message
 * @param matches matches implicated (may be empty)
 * @param level severity
 * @param priority weight the finding contributed to the score (0 until the schedule attaches it)
 */
public record RuleViolation(
        String rule,
        String description,
        List<Match> matches,
        ViolationLevel level,
        int priority
) {
    public RuleViolation {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public RuleViolation(String rule, String description, List<Match> matches, ViolationLevel level) {
        this(rule, description, matches, level, 0);
    }

    public RuleViolation withPriority(int priority) {
        return new RuleViolation(rule, description, matches, level, priority);
    }

    public RuleViolation withMatches(List<Match> remapped) {
        return new RuleViolation(rule, description, remapped, level, priority);
    }

    public boolean isCritical() {
        return level == ViolationLevel.CRITICAL;
    }
}
