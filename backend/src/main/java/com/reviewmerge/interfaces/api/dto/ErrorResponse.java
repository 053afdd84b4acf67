package com.reviewmerge.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
