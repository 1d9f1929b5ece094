package com.campussecurity.dispatch.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Incident lifecycle. RESOLVED is terminal.
 */
public enum IncidentStatus {
    CREATED,
    ASSIGNED,
    IN_PROGRESS,
    RESOLVED;

    /**
     * Statuses that count as "open" for deduplication: a beacon may hold at most one
     * incident in any of these.
     */
    public static final Set<IncidentStatus> OPEN = EnumSet.of(CREATED, ASSIGNED, IN_PROGRESS);

    public boolean isOpen() {
        return this != RESOLVED;
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return switch (this) {
            case CREATED -> target == ASSIGNED || target == RESOLVED;
            case ASSIGNED -> target == IN_PROGRESS || target == CREATED || target == RESOLVED;
            case IN_PROGRESS -> target == RESOLVED || target == CREATED;
            case RESOLVED -> false;
        };
    }
}
