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
 * One observation attached to an incident. Signals are facts: they are inserted once and
 * never updated or deleted, so the entity exposes no setters.
 */
@Entity
@Immutable
@Table(name = "incident_signals", indexes = {
    @Index(name = "idx_signal_incident_created", columnList = "incident_id, created_at"),
    @Index(name = "idx_signal_type_created", columnList = "signal_type, created_at")
})
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentSignal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false)
    private Long incidentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_type", nullable = false, length = 30, updatable = false)
    private SignalType signalType;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", length = 20, updatable = false)
    private ActorRole actorRole;

    /**
     * Student/guard id for human reports, device id for panic buttons and AI detectors.
     */
    @Column(name = "actor_id", length = 100, updatable = false)
    private String actorId;

    /**
     * Detector confidence for AI signals, already computed upstream.
     */
    @Column(updatable = false)
    private Double confidence;

    @Convert(converter = SignalDetailsConverter.class)
    @Column(columnDefinition = "text", updatable = false)
    private Map<String, Object> details;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
