package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;

import java.util.List;

abstract class AbstractScheduleRule implements ScheduleRule {

    private final String name;
    private final int priority;

    protected AbstractScheduleRule(String name, int priority) {
        if (priority < 1) throw new IllegalArgumentException("Rule priority must be positive: " + priority);
        this.name = name;
        this.priority = priority;
    }

    @Override public String name() { return name; }

    @Override public int priority() { return priority; }

    protected RuleViolation violation(String description, List<Match> matches, ViolationLevel level) {
        return new RuleViolation(name, description, matches, level);
    }

    @Override
    public String toString() {
        return name + " (priority " + priority + ")";
    }
}
