package com.campussecurity.dispatch.exception;

/**
 * The responding guard is not the addressee of the alert.
 */
public class InvalidGuardException extends DispatchException {

    public InvalidGuardException(Long alertId, Long respondingGuardId) {
        super("INVALID_GUARD",
            "Guard " + respondingGuardId + " cannot respond to alert " + alertId);
    }

    private InvalidGuardException(String message) {
        super("INVALID_GUARD", message);
    }

    public static InvalidGuardException notAssigned(Long incidentId, Object guardRef) {
        return new InvalidGuardException("Guard " + guardRef + " is not assigned to incident " + incidentId);
    }
}
