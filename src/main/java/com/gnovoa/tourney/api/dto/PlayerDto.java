package com.gnovoa.tourney.api.dto;

public record PlayerDto(String name, String mixedTeam, String genderedTeam, String clothTeam) {}
