package com.campussecurity.dispatch.exception;

public class GuardUnavailableException extends DispatchException {

    public GuardUnavailableException(Long guardId, Long committedIncidentId) {
        super("GUARD_UNAVAILABLE",
            "Guard " + guardId + " is already assigned to incident " + committedIncidentId);
    }
}
