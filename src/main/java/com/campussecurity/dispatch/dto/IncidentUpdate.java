package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentPriority;
import com.campussecurity.dispatch.entity.IncidentStatus;

/**
 * Incident state broadcast to dashboards after a committed transition.
 */
public record IncidentUpdate(
    Long incidentId,
    Long beaconId,
    IncidentStatus status,
    IncidentPriority priority,
    Long assignedGuardId,
    String reason
) {

    public static IncidentUpdate of(Incident incident, String reason) {
        return new IncidentUpdate(
            incident.getId(),
            incident.getBeaconId(),
            incident.getStatus(),
            incident.getPriority(),
            incident.getCurrentAssignedGuardId(),
            reason
        );
    }
}
