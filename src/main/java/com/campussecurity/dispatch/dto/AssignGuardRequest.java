package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AssignGuardRequest(
    @NotNull(message = "Guard ID is required")
    Long guardId,

    @NotBlank(message = "Admin ID is required")
    String adminId
) {
}
