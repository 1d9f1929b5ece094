package com.campussecurity.dispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Fixed indoor location marker (iBeacon/Eddystone) that incidents and guards are pinned to.
 *
 * Beacons are maintained by the admin console. They are never deleted while an incident
 * references them; decommissioning is done through the {@code active} flag.
 *
 * The beacon row doubles as the per-beacon lock: incident creation and proximity edits
 * take a {@code SELECT ... FOR UPDATE} on it before touching beacon-scoped state.
 */
@Entity
@Table(name = "beacons", indexes = {
    @Index(name = "idx_beacon_hardware_id", columnList = "hardware_id", unique = true),
    @Index(name = "idx_beacon_building_floor", columnList = "building, floor"),
    @Index(name = "idx_beacon_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Beacon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Hardware identifier broadcast by the device (e.g. "safe:uuid:403:403").
     * This is the id inbound signals and guard location pings refer to.
     */
    @Column(name = "hardware_id", nullable = false, unique = true, length = 100)
    private String hardwareId;

    /**
     * Human-readable location, e.g. "Library Entrance" or "Hallway 3A".
     */
    @Column(name = "location_name", nullable = false)
    private String locationName;

    @Column(nullable = false)
    private String building;

    @Column(nullable = false)
    private Integer floor;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isOperational() {
        return Boolean.TRUE.equals(active);
    }

    public String toLogString() {
        return String.format("Beacon[id=%d, hw=%s, location=%s]", id, hardwareId, locationName);
    }
}
