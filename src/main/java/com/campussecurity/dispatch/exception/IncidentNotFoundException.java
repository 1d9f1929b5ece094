package com.campussecurity.dispatch.exception;

public class IncidentNotFoundException extends DispatchException {

    public IncidentNotFoundException(Long incidentId) {
        super("INCIDENT_NOT_FOUND", "Incident not found: " + incidentId);
    }
}
