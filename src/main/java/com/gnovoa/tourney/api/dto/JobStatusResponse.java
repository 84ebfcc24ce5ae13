package com.gnovoa.tourney.api.dto;

import com.gnovoa.tourney.runner.RunnerStatus;

/** @param best best schedule so far; null until the job reports progress */
public record JobStatusResponse(RunnerStatus status, EvaluationResponse best) {}
