package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record PriorityChangeRequest(
    @NotNull(message = "Priority is required")
    @Min(value = 1, message = "Priority must be >= 1")
    Integer priority
) {
}
