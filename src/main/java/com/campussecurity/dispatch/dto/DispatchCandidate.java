package com.campussecurity.dispatch.dto;

import java.util.List;

/**
 * A guard found by the expanding-radius search.
 *
 * @param guardId     guard profile id
 * @param guardName   display name, for logs and notifications
 * @param viaBeaconId beacon where the guard was found
 * @param hopPriority sum of the edge priorities traversed from the origin; 0 at the origin
 * @param route       beacon ids from the origin to {@code viaBeaconId}, both inclusive
 */
public record DispatchCandidate(
    Long guardId,
    String guardName,
    Long viaBeaconId,
    int hopPriority,
    List<Long> route
) {

    public DispatchCandidate {
        route = List.copyOf(route);
    }

    public int hopCount() {
        return route.size() - 1;
    }
}
