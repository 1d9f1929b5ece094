package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.ResolutionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ResolveIncidentRequest(
    @NotNull(message = "Actor role is required")
    ActorRole actorRole,

    @NotBlank(message = "Actor ID is required")
    String actorId,

    @NotBlank(message = "Resolution notes are required")
    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    String notes,

    ResolutionType resolutionType
) {
}
