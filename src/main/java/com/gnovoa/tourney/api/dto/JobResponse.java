package com.gnovoa.tourney.api.dto;

import java.util.Map;

public record JobResponse(String jobId, String status, Map<String, String> ws) {}
