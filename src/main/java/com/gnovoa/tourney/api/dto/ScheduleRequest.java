package com.gnovoa.tourney.api.dto;

import java.util.List;
import java.util.Map;

/**
 * @param teams team names by division id that have no players listed; optional
 * @param ruleIds rules to evaluate; empty means every enabled rule
 */
public record ScheduleRequest(
        List<PlayerDto> players,
        Map<String, List<String>> teams,
        List<MatchDto> matches,
        List<String> ruleIds
) {}
