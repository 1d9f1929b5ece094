package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardAssignment;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEvent;
import com.campussecurity.dispatch.entity.IncidentSignal;

import java.util.List;

/**
 * Incident with everything attached to it, for the read API.
 */
public record IncidentDetail(
    Incident incident,
    List<IncidentSignal> signals,
    List<GuardAlert> alerts,
    List<GuardAssignment> assignments,
    List<IncidentEvent> events
) {
}
