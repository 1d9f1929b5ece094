package com.campussecurity.dispatch.dto;

/**
 * Result of a guard response or deadline expiry.
 */
public enum AlertOutcome {
    /** Alert accepted; the guard now holds the incident's assignment. */
    ACCEPTED,
    DECLINED,
    EXPIRED,
    /** Lost the accept race: another guard already holds the incident. The alert was expired. */
    ALREADY_ASSIGNED,
    /** The guard is already committed to another incident. The alert was expired. */
    GUARD_UNAVAILABLE,
    /** The incident was resolved before the response arrived. The alert was expired. */
    INCIDENT_CLOSED,
    /** The alert was no longer SENT; nothing changed. */
    STALE_OR_TERMINAL
}
