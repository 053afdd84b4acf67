package com.reviewmerge.interfaces.api.dto;

public record ConsolidationLimitsResponse(int maxSources, String reportVersion) {}
