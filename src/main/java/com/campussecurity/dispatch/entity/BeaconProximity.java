package com.campussecurity.dispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed edge of the beacon adjacency graph used by the expanding-radius guard search.
 *
 * Priorities among edges sharing the same {@code fromBeaconId} form a dense sequence
 * 1..n (1 = same floor / nearest). The sequence is maintained by
 * {@link com.campussecurity.dispatch.service.ProximityGraphService}; there is
 * no unique constraint on (from, priority) because the shift updates pass through
 * transient duplicates.
 */
@Entity
@Table(
    name = "beacon_proximities",
    uniqueConstraints = @UniqueConstraint(name = "uk_beacon_pair", columnNames = {"from_beacon_id", "to_beacon_id"}),
    indexes = @Index(name = "idx_proximity_from_priority", columnList = "from_beacon_id, priority")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeaconProximity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_beacon_id", nullable = false)
    private Long fromBeaconId;

    @Column(name = "to_beacon_id", nullable = false)
    private Long toBeaconId;

    /**
     * Lower number = nearer. 1 = same floor, 2 = adjacent floor, 3+ = further zones.
     */
    @Column(nullable = false)
    private Integer priority;
}
