package com.assessorai.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RunRequest(
        @Pattern(regexp = "[A-Za-z0-9._-]{1,128}", message = "Run id may only contain letters, digits, '.', '_' and '-'")
        String runId,

        @NotEmpty(message = "At least one input is required")
        @Size(max = 50, message = "At most 50 inputs per run")
        List<String> inputs,

        String profile
) {}
