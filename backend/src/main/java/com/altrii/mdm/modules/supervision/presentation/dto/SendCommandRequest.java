package com.altrii.mdm.modules.supervision.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

public record SendCommandRequest(
        @NotBlank String commandType,
        Map<String, Object> parameters
) {
}
