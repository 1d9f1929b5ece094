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
 * The unit of dispatch: one emergency at one beacon.
 *
 * Dedup contract:
 * At most one non-resolved incident exists per beacon. The service layer enforces it under
 * the beacon row lock, and the database enforces it through {@code open_beacon_id}: the column
 * mirrors {@code beacon_id} while the incident is open and is cleared on resolution, so a
 * unique constraint over it rejects a second open incident even if two creators race past the
 * lock. NULLs are not compared by the constraint, so resolved incidents never collide.
 *
 * Incidents are never physically deleted; RESOLVED is the soft-terminal state.
 */
@Entity
@Table(
    name = "incidents",
    uniqueConstraints = @UniqueConstraint(name = Incident.OPEN_BEACON_CONSTRAINT, columnNames = "open_beacon_id"),
    indexes = {
        @Index(name = "idx_incident_beacon_status", columnList = "beacon_id, status, created_at"),
        @Index(name = "idx_incident_status_created", columnList = "status, created_at"),
        @Index(name = "idx_incident_created_at", columnList = "created_at")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Incident {

    public static final String OPEN_BEACON_CONSTRAINT = "uk_incident_open_beacon";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Location of the emergency. Fixed at creation.
     */
    @Column(name = "beacon_id", nullable = false, updatable = false)
    private Long beaconId;

    /**
     * Equal to {@link #beaconId} while the incident is open, NULL once resolved.
     */
    @Column(name = "open_beacon_id")
    private Long openBeaconId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private IncidentStatus status = IncidentStatus.CREATED;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private IncidentPriority priority = IncidentPriority.MEDIUM;

    @Column(length = 2000)
    private String description;

    @Column(name = "first_signal_time")
    private Instant firstSignalTime;

    @Column(name = "last_signal_time")
    private Instant lastSignalTime;

    @Column(name = "current_assigned_guard_id")
    private Long currentAssignedGuardId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_type", length = 30)
    private ResolutionType resolutionType;

    @Column(name = "total_alerts_sent", nullable = false)
    @Builder.Default
    private Integer totalAlertsSent = 0;

    @Column(name = "total_alerts_declined", nullable = false)
    @Builder.Default
    private Integer totalAlertsDeclined = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Opens a new incident at the given beacon from its first signal.
     */
    public static Incident open(Long beaconId, SignalType firstSignal, String description, Instant now) {
        return Incident.builder()
            .beaconId(beaconId)
            .openBeaconId(beaconId)
            .status(IncidentStatus.CREATED)
            .priority(firstSignal.impliedPriority())
            .description(description == null ? "" : description)
            .firstSignalTime(now)
            .lastSignalTime(now)
            .build();
    }

    public boolean isOpen() {
        return status != null && status.isOpen();
    }

    /**
     * Moves to RESOLVED and releases the beacon for the next incident.
     */
    public void markResolved(String actor, String notes, ResolutionType type, Instant now) {
        this.status = IncidentStatus.RESOLVED;
        this.openBeaconId = null;
        this.resolvedBy = actor;
        this.resolvedAt = now;
        this.resolutionNotes = notes;
        this.resolutionType = type;
    }

    public void recordAlertsSent(int count) {
        this.totalAlertsSent = (totalAlertsSent == null ? 0 : totalAlertsSent) + count;
    }

    public void recordDecline() {
        this.totalAlertsDeclined = (totalAlertsDeclined == null ? 0 : totalAlertsDeclined) + 1;
    }

    public String toLogString() {
        return String.format("Incident[id=%d, beacon=%d, status=%s, priority=%s]",
            id, beaconId, status, priority);
    }
}
