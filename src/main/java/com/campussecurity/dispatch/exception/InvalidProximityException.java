package com.campussecurity.dispatch.exception;

public class InvalidProximityException extends DispatchException {

    public InvalidProximityException(String message) {
        super("INVALID_PROXIMITY", message);
    }
}
