package com.campussecurity.dispatch.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Location ping from the guard app: the hardware id of the strongest beacon in range.
 *
 * @param guardId  guard profile id; taken from the path on REST, from the body on STOMP
 * @param beaconId beacon hardware id
 */
public record LocationUpdateRequest(
    Long guardId,

    @NotBlank(message = "Beacon ID is required")
    String beaconId
) {

    public LocationUpdateRequest withGuardId(Long pathGuardId) {
        return new LocationUpdateRequest(pathGuardId, beaconId);
    }
}
