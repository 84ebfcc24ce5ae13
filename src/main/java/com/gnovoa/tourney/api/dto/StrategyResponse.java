package com.gnovoa.tourney.api.dto;

public record StrategyResponse(String id, String name, String description) {}
