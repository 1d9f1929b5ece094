package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Guard accepting or declining an alert, or starting the response to their incident.
 */
public record GuardResponseRequest(
    @NotNull(message = "Guard ID is required")
    Long guardId
) {
}
