package com.campussecurity.dispatch.dto;

/**
 * Outgoing edge in the cached beacon graph.
 */
public record ProximityEdge(Long toBeaconId, int priority) {
}
