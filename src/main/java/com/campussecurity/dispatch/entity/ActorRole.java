package com.campussecurity.dispatch.entity;

/**
 * Who (or what) originated a signal or an administrative action.
 */
public enum ActorRole {
    STUDENT,
    GUARD,
    ADMIN,
    DEVICE,
    SYSTEM
}
