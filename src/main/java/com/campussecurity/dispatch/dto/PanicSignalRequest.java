package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * ESP32 panic button press.
 */
public record PanicSignalRequest(
    @NotBlank(message = "Device ID is required")
    String deviceId,

    Map<String, Object> details
) {
}
