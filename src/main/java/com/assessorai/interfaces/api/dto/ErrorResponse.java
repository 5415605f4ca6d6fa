package com.assessorai.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
