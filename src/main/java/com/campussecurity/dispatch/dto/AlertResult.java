package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardAssignment;

/**
 * What happened to an alert after accept/decline/expire.
 *
 * @param alert          the alert in its post-transition state
 * @param outcome        transition outcome
 * @param assignment     assignment created or reused on acceptance, otherwise null
 * @param escalatedAlert next alert issued by escalation, null when none was issued
 */
public record AlertResult(
    GuardAlert alert,
    AlertOutcome outcome,
    GuardAssignment assignment,
    GuardAlert escalatedAlert
) {

    public static AlertResult of(GuardAlert alert, AlertOutcome outcome) {
        return new AlertResult(alert, outcome, null, null);
    }

    public boolean escalated() {
        return escalatedAlert != null;
    }

    public boolean changedState() {
        return outcome != AlertOutcome.STALE_OR_TERMINAL;
    }
}
