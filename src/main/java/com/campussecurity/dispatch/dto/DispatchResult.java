package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentSignal;

import java.util.List;

/**
 * Outcome of one inbound signal.
 *
 * @param incident     incident the signal landed on; null when the signal was suppressed
 * @param wasCreated   true when this signal opened the incident
 * @param signal       stored signal; null when suppressed
 * @param alerts       alerts issued by this call (only on creation)
 * @param noCandidates the incident was created but the search found nobody to alert
 * @param suppressed   AI detection below its confidence threshold; nothing was stored
 */
public record DispatchResult(
    Incident incident,
    boolean wasCreated,
    IncidentSignal signal,
    List<GuardAlert> alerts,
    boolean noCandidates,
    boolean suppressed
) {

    public DispatchResult {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static DispatchResult merged(IncidentResolution resolution) {
        return new DispatchResult(resolution.incident(), false, resolution.signal(), List.of(), false, false);
    }

    public static DispatchResult created(IncidentResolution resolution, List<GuardAlert> alerts) {
        return new DispatchResult(resolution.incident(), true, resolution.signal(), alerts, alerts.isEmpty(), false);
    }

    public static DispatchResult suppressedSignal() {
        return new DispatchResult(null, false, null, List.of(), false, true);
    }
}
