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
 * A dispatch offer from one incident to one guard.
 *
 * The (incident, guard) pair is unique, so a guard is alerted at most once per incident
 * whatever the alert's fate; escalation always moves on to a different guard.
 * {@code priorityRank} grows monotonically in creation order within an incident.
 */
@Entity
@Table(
    name = "guard_alerts",
    uniqueConstraints = @UniqueConstraint(name = "uk_alert_incident_guard", columnNames = {"incident_id", "guard_id"}),
    indexes = {
        @Index(name = "idx_alert_incident_status", columnList = "incident_id, status"),
        @Index(name = "idx_alert_guard_status", columnList = "guard_id, status"),
        @Index(name = "idx_alert_status_deadline", columnList = "status, response_deadline")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuardAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false)
    private Long incidentId;

    @Column(name = "guard_id", nullable = false, updatable = false)
    private Long guardId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AlertStatus status = AlertStatus.SENT;

    /**
     * 1 = first choice.
     */
    @Column(name = "priority_rank", nullable = false, updatable = false)
    private Integer priorityRank;

    /**
     * Beacon where the search found the guard.
     */
    @Column(name = "via_beacon_id")
    private Long viaBeaconId;

    /**
     * Cumulative edge priority from the incident beacon to {@link #viaBeaconId}; 0 = same beacon.
     */
    @Column(name = "hop_priority")
    private Integer hopPriority;

    @Column(name = "response_deadline")
    private Instant responseDeadline;

    @Column(name = "responded_at")
    private Instant respondedAt;

    /**
     * Assignment produced by accepting this alert.
     */
    @Column(name = "assignment_id")
    private Long assignmentId;

    @CreationTimestamp
    @Column(name = "alert_sent_at", nullable = false, updatable = false)
    private Instant alertSentAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isPending() {
        return status == AlertStatus.SENT;
    }

    public void close(AlertStatus terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal alert status: " + terminal);
        }
        this.status = terminal;
        this.respondedAt = now;
    }

    public String toLogString() {
        return String.format("Alert[id=%d, incident=%d, guard=%d, rank=%d, status=%s]",
            id, incidentId, guardId, priorityRank, status);
    }
}
