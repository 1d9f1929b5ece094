package com.campussecurity.dispatch.dto;

/**
 * Message kinds pushed to guards.
 */
public enum NotificationKind {
    INCIDENT_ALERT,
    ASSIGNMENT_CONFIRMED,
    ALERT_WITHDRAWN,
    ASSIGNMENT_REVOKED
}
