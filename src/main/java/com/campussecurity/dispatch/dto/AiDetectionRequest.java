package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Detection reported by an AI vision or audio device. The confidence is computed upstream.
 */
public record AiDetectionRequest(
    @NotBlank(message = "Device ID is required")
    String deviceId,

    @NotNull(message = "Confidence is required")
    @DecimalMin(value = "0.0", message = "Confidence must be >= 0")
    @DecimalMax(value = "1.0", message = "Confidence must be <= 1")
    Double confidence,

    Map<String, Object> details
) {
}
