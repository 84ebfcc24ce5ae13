package com.gnovoa.tourney.api.dto;

public record OptimizationRequest(ScheduleRequest schedule, Integer iterations, String strategy) {}
