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
 * Dispatch-relevant state of one guard.
 *
 * Location is beacon-based: the mobile app reports the nearest beacon every 10-15 seconds and
 * {@code currentBeaconId} becomes the guard's BFS position. A guard that never reported a
 * beacon is never a dispatch candidate.
 */
@Entity
@Table(name = "guard_profiles", indexes = {
    @Index(name = "idx_guard_current_beacon", columnList = "current_beacon_id"),
    @Index(name = "idx_guard_available", columnList = "available"),
    @Index(name = "idx_guard_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuardProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    /**
     * On duty.
     */
    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    /**
     * Willing to take incidents right now (self/admin toggle).
     */
    @Column(nullable = false)
    @Builder.Default
    private Boolean available = true;

    /**
     * Mirrors the login account's enabled flag, owned by the authentication service.
     */
    @Column(name = "account_active", nullable = false)
    @Builder.Default
    private Boolean accountActive = true;

    @Column(name = "current_beacon_id")
    private Long currentBeaconId;

    @Column(name = "last_beacon_update")
    private Instant lastBeaconUpdate;

    @Column(name = "last_active_at")
    private Instant lastActiveAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isDispatchable() {
        return Boolean.TRUE.equals(active)
            && Boolean.TRUE.equals(available)
            && Boolean.TRUE.equals(accountActive)
            && currentBeaconId != null;
    }
}
