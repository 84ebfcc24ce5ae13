package com.gnovoa.tourney.api.dto;

import java.util.List;

public record EvaluationResponse(int score, List<ViolationDto> violations, List<MatchDto> matches) {}
