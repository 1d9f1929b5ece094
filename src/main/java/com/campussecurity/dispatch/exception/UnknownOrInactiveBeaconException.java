package com.campussecurity.dispatch.exception;

/**
 * A signal or location update referenced a beacon that does not exist or is disabled.
 * Not retried.
 */
public class UnknownOrInactiveBeaconException extends DispatchException {

    private final String beaconRef;

    public UnknownOrInactiveBeaconException(String beaconRef) {
        super("UNKNOWN_OR_INACTIVE_BEACON", "Invalid or inactive beacon: " + beaconRef);
        this.beaconRef = beaconRef;
    }

    public String getBeaconRef() {
        return beaconRef;
    }
}
