package com.gnovoa.tourney.api.dto;

import com.gnovoa.tourney.model.ViolationLevel;

import java.util.List;

public record ViolationDto(String rule, String description, ViolationLevel level, int priority, List<String> matchIds) {}
