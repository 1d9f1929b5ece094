package com.campussecurity.dispatch.exception;

import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.SignalType;

public class InvalidActorException extends DispatchException {

    public InvalidActorException(SignalType signalType, ActorRole role) {
        super("INVALID_ACTOR", "Actor role " + role + " cannot raise a " + signalType + " signal");
    }

    public InvalidActorException(String message) {
        super("INVALID_ACTOR", message);
    }
}
