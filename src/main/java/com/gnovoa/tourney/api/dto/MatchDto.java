package com.gnovoa.tourney.api.dto;

import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Division;

/**
 * A match on the wire. {@code matchId} is ignored on input; {@code activityType} defaults to REGULAR
 * and {@code locked} to false.
 */
public record MatchDto(
        String matchId,
        String team1,
        String team2,
        int timeSlot,
        String field,
        Division division,
        String refereeTeam,
        ActivityType activityType,
        Boolean locked
) {}
