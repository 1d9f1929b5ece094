package com.campussecurity.dispatch.entity;

/**
 * Audit trail event kinds, covering the incident from first signal to resolution.
 */
public enum IncidentEventType {
    INCIDENT_CREATED,
    SIGNAL_MERGED,
    STATUS_CHANGED,
    PRIORITY_CHANGED,

    ALERT_SENT,
    ALERT_DELIVERED,
    ALERT_FAILED,

    ALERT_ACCEPTED,
    ALERT_DECLINED,
    ALERT_EXPIRED,

    GUARD_ASSIGNED,
    GUARD_UNASSIGNED,

    RESOLUTION_STARTED,
    INCIDENT_RESOLVED,

    ALL_GUARDS_EXHAUSTED
}
