package com.campussecurity.dispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record of the incident lifecycle.
 */
@Entity
@Immutable
@Table(name = "incident_events", indexes = {
    @Index(name = "idx_event_incident_created", columnList = "incident_id, created_at"),
    @Index(name = "idx_event_type_created", columnList = "event_type, created_at"),
    @Index(name = "idx_event_target_guard", columnList = "target_guard_id, created_at")
})
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false)
    private Long incidentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40, updatable = false)
    private IncidentEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", length = 20, updatable = false)
    private ActorRole actorRole;

    @Column(name = "actor_id", length = 100, updatable = false)
    private String actorId;

    @Column(name = "target_guard_id", updatable = false)
    private Long targetGuardId;

    @Column(name = "alert_id", updatable = false)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 20, updatable = false)
    private IncidentStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 20, updatable = false)
    private IncidentStatus newStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_priority", length = 20, updatable = false)
    private IncidentPriority previousPriority;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_priority", length = 20, updatable = false)
    private IncidentPriority newPriority;

    @Convert(converter = SignalDetailsConverter.class)
    @Column(columnDefinition = "text", updatable = false)
    private Map<String, Object> details;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
