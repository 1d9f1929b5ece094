package com.campussecurity.dispatch.entity;

/**
 * Incident urgency, ordered from LOW to CRITICAL. Declaration order is significant:
 * {@link #max(IncidentPriority)} relies on it.
 */
public enum IncidentPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public IncidentPriority max(IncidentPriority other) {
        if (other == null) {
            return this;
        }
        return compareTo(other) >= 0 ? this : other;
    }
}
