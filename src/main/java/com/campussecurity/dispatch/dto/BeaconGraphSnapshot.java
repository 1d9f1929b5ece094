package com.campussecurity.dispatch.dto;

import java.util.List;
import java.util.Map;

/**
 * Immutable, cacheable view of the beacon adjacency graph.
 *
 * Dispatch searches read one snapshot for their whole traversal, so a concurrent admin edit
 * is either fully visible or not visible at all. Edge lists are already sorted by ascending
 * priority.
 *
 * @param adjacency from-beacon id to its outgoing edges
 */
public record BeaconGraphSnapshot(Map<Long, List<ProximityEdge>> adjacency) {

    public BeaconGraphSnapshot {
        adjacency = adjacency == null ? Map.of() : Map.copyOf(adjacency);
    }

    public static BeaconGraphSnapshot empty() {
        return new BeaconGraphSnapshot(Map.of());
    }

    public List<ProximityEdge> edgesFrom(Long beaconId) {
        return adjacency.getOrDefault(beaconId, List.of());
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(List::size).sum();
    }
}
