package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.List;

/**
 * A scheduling rule. Rules only read the schedule; the schedule multiplies each returned violation by
 * {@link #priority()} when it computes its score.
 */
public interface ScheduleRule {

    String name();

    /** Positive weight; higher means more important. */
    int priority();

    List<RuleViolation> evaluate(Schedule schedule);
}
