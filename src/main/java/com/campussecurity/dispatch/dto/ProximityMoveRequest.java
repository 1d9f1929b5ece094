package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotNull;

public record ProximityMoveRequest(
    @NotNull(message = "Direction is required")
    ProximityMove direction
) {
}
