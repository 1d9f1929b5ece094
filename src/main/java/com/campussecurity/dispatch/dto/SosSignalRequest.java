package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.SignalType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Student SOS report from the mobile app.
 *
 * @param beaconId     hardware id of the nearest beacon
 * @param reporterRole STUDENT, GUARD or ADMIN (a guard may raise an SOS on a student's behalf)
 * @param reporterId   reporter's user id
 * @param description  optional free text
 * @param details      optional extra fields, stored with the signal
 */
public record SosSignalRequest(
    @NotBlank(message = "Beacon ID is required")
    String beaconId,

    @NotNull(message = "Reporter role is required")
    ActorRole reporterRole,

    @NotBlank(message = "Reporter ID is required")
    String reporterId,

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    String description,

    Map<String, Object> details
) {

    public SignalCommand toCommand() {
        return new SignalCommand(
            beaconId,
            SignalType.STUDENT_SOS,
            new SignalActor(reporterRole, reporterId),
            description,
            null,
            details
        );
    }
}
