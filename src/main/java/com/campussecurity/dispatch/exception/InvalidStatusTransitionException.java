package com.campussecurity.dispatch.exception;

import com.campussecurity.dispatch.entity.IncidentStatus;

public class InvalidStatusTransitionException extends DispatchException {

    public InvalidStatusTransitionException(Long incidentId, IncidentStatus from, IncidentStatus to) {
        super("INVALID_STATUS_TRANSITION",
            "Incident " + incidentId + " cannot move from " + from + " to " + to);
    }

    public InvalidStatusTransitionException(Long incidentId, String reason) {
        super("INVALID_STATUS_TRANSITION", "Incident " + incidentId + ": " + reason);
    }
}
