package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentPriority;
import com.campussecurity.dispatch.entity.IncidentStatus;
import lombok.Builder;

import java.util.Map;

/**
 * One entry for the append-only audit sink.
 */
@Builder
public record AuditEvent(
    Long incidentId,
    IncidentEventType type,
    ActorRole actorRole,
    String actorId,
    Long targetGuardId,
    Long alertId,
    IncidentStatus previousStatus,
    IncidentStatus newStatus,
    IncidentPriority previousPriority,
    IncidentPriority newPriority,
    Map<String, Object> details
) {

    public static AuditEvent of(Long incidentId, IncidentEventType type) {
        return AuditEvent.builder().incidentId(incidentId).type(type).build();
    }
}
