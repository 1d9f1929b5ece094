package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.ActorRole;

import java.util.Objects;

/**
 * Originator of a signal or an administrative action.
 *
 * @param role    closed set of roles, matched exhaustively at the orchestrator boundary
 * @param actorId student/guard/admin id, or device id; may be null for SYSTEM
 */
public record SignalActor(ActorRole role, String actorId) {

    public SignalActor {
        Objects.requireNonNull(role, "role");
    }

    public static SignalActor student(String studentId) {
        return new SignalActor(ActorRole.STUDENT, studentId);
    }

    public static SignalActor guard(Long guardId) {
        return new SignalActor(ActorRole.GUARD, guardId == null ? null : String.valueOf(guardId));
    }

    public static SignalActor admin(String adminId) {
        return new SignalActor(ActorRole.ADMIN, adminId);
    }

    public static SignalActor device(String deviceId) {
        return new SignalActor(ActorRole.DEVICE, deviceId);
    }

    public static SignalActor system() {
        return new SignalActor(ActorRole.SYSTEM, "dispatch-engine");
    }

    public String toLogString() {
        return role + ":" + actorId;
    }
}
