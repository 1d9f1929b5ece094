package com.campussecurity.dispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Binding of one guard to one incident.
 *
 * Uniqueness is enforced in the schema, not just checked before writing:
 * {@code active_incident_id} and {@code active_guard_id} copy the incident and guard ids while
 * the assignment is active and are cleared on deactivation. Each carries a unique constraint,
 * so the database rejects a second active assignment for the same incident or the same guard.
 *
 * Assignments are soft-deactivated, never deleted.
 */
@Entity
@Table(
    name = "guard_assignments",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_assignment_active_incident", columnNames = "active_incident_id"),
        @UniqueConstraint(name = "uk_assignment_active_guard", columnNames = "active_guard_id")
    },
    indexes = {
        @Index(name = "idx_assignment_incident_active", columnList = "incident_id, active"),
        @Index(name = "idx_assignment_guard_active", columnList = "guard_id, active")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuardAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false)
    private Long incidentId;

    @Column(name = "guard_id", nullable = false, updatable = false)
    private Long guardId;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = false;

    @Column(name = "active_incident_id")
    private Long activeIncidentId;

    @Column(name = "active_guard_id")
    private Long activeGuardId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "deactivation_reason", length = 50)
    private String deactivationReason;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void activate(Instant now) {
        this.active = true;
        this.activeIncidentId = incidentId;
        this.activeGuardId = guardId;
        this.assignedAt = now;
        this.deactivatedAt = null;
        this.deactivationReason = null;
    }

    public void deactivate(String reason, Instant now) {
        this.active = false;
        this.activeIncidentId = null;
        this.activeGuardId = null;
        this.deactivatedAt = now;
        this.deactivationReason = reason;
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }
}
