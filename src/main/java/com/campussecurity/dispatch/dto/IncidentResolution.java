package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentSignal;

/**
 * Outcome of the dedup decision: the incident the signal landed on, whether it was opened by
 * this signal, and the stored signal.
 */
public record IncidentResolution(Incident incident, boolean wasCreated, IncidentSignal signal) {
}
