package com.campussecurity.dispatch.exception;

public class GuardNotFoundException extends DispatchException {

    public GuardNotFoundException(Long guardId) {
        super("GUARD_NOT_FOUND", "Guard profile not found: " + guardId);
    }
}
