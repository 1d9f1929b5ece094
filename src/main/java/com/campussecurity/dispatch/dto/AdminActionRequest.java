package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of admin-only incident actions (unassign, redispatch).
 */
public record AdminActionRequest(
    @NotBlank(message = "Admin ID is required")
    String adminId
) {
}
