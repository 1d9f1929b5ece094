package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * New edge from the path beacon.
 *
 * @param toBeaconId neighbour beacon id
 * @param priority   position among the beacon's edges, 1 = nearest; omitted appends
 */
public record ProximityRequest(
    @NotNull(message = "Target beacon ID is required")
    Long toBeaconId,

    @Min(value = 1, message = "Priority must be >= 1")
    Integer priority
) {
}
