package com.campussecurity.dispatch.exception;

public class ProximityNotFoundException extends DispatchException {

    public ProximityNotFoundException(Long fromBeaconId, Long proximityId) {
        super("PROXIMITY_NOT_FOUND",
            "Proximity " + proximityId + " not found for beacon " + fromBeaconId);
    }
}
