package com.campussecurity.dispatch.dto;

/**
 * Either flag may be omitted to leave it unchanged.
 */
public record AvailabilityRequest(
    Boolean available,
    Boolean onDuty
) {
}
