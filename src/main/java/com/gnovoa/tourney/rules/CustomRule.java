package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Wraps a caller-supplied evaluation function as a rule. */
public final class CustomRule extends AbstractScheduleRule {

    private final Function<Schedule, List<RuleViolation>> evaluator;

    public CustomRule(String name, int priority, Function<Schedule, List<RuleViolation>> evaluator) {
        super(name, priority);
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> found = evaluator.apply(schedule);
        return found == null ? List.of() : found;
    }
}
