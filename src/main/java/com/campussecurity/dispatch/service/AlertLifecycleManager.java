package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.config.DispatchProperties;
import com.campussecurity.dispatch.dto.AlertOutcome;
import com.campussecurity.dispatch.dto.AlertResult;
import com.campussecurity.dispatch.dto.AuditEvent;
import com.campussecurity.dispatch.dto.DispatchCandidate;
import com.campussecurity.dispatch.dto.EscalationSummary;
import com.campussecurity.dispatch.dto.GuardNotification;
import com.campussecurity.dispatch.dto.IncidentUpdate;
import com.campussecurity.dispatch.dto.NotificationKind;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardAssignment;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.entity.ResolutionType;
import com.campussecurity.dispatch.exception.AlertNotFoundException;
import com.campussecurity.dispatch.exception.GuardNotFoundException;
import com.campussecurity.dispatch.exception.GuardUnavailableException;
import com.campussecurity.dispatch.exception.IncidentNotFoundException;
import com.campussecurity.dispatch.exception.InvalidGuardException;
import com.campussecurity.dispatch.exception.InvalidStatusTransitionException;
import com.campussecurity.dispatch.repository.GuardAlertRepository;
import com.campussecurity.dispatch.repository.GuardAssignmentRepository;
import com.campussecurity.dispatch.repository.GuardProfileRepository;
import com.campussecurity.dispatch.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Guard alert state machine and the only writer of {@link GuardAssignment}.
 *
 * Alert states: SENT -> {ACCEPTED | DECLINED | EXPIRED}, all terminal.
 *
 * Every transition runs in its own transaction and starts by locking the incident row, so
 * transitions of one incident are serialized while different incidents proceed in parallel.
 * The alert is read only after that lock is held.
 *
 * First-acceptor-wins:
 * - The winning accept creates the active assignment and expires every other SENT alert
 * - A later accept of a stood-down alert reports ALREADY_ASSIGNED
 * - A guard accepting two incidents at once is stopped by the active-guard unique constraint;
 *   the losing transaction rolls back and is replayed once, and the replay reports
 *   GUARD_UNAVAILABLE and escalates to the next guard
 *
 * Push messages are published as events inside the transaction and delivered after commit
 * by {@link NotificationDispatcher}.
 */
@Service
@Slf4j
public class AlertLifecycleManager {

    private static final String REASON_DEADLINE = "DEADLINE";
    private static final String REASON_ALREADY_ASSIGNED = "ALREADY_ASSIGNED";
    private static final String REASON_GUARD_UNAVAILABLE = "GUARD_UNAVAILABLE";
    private static final String REASON_INCIDENT_CLOSED = "INCIDENT_CLOSED";
    private static final String REASON_MANUAL_ASSIGNMENT = "MANUAL_ASSIGNMENT";

    private final IncidentRepository incidentRepository;
    private final GuardAlertRepository alertRepository;
    private final GuardAssignmentRepository assignmentRepository;
    private final GuardProfileRepository guardRepository;
    private final DispatchSearchService searchService;
    private final AuditSink auditSink;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration responseTimeout;
    private final int maxGuards;

    public AlertLifecycleManager(IncidentRepository incidentRepository,
                                 GuardAlertRepository alertRepository,
                                 GuardAssignmentRepository assignmentRepository,
                                 GuardProfileRepository guardRepository,
                                 DispatchSearchService searchService,
                                 AuditSink auditSink,
                                 ApplicationEventPublisher eventPublisher,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock,
                                 DispatchProperties properties) {
        this.incidentRepository = incidentRepository;
        this.alertRepository = alertRepository;
        this.assignmentRepository = assignmentRepository;
        this.guardRepository = guardRepository;
        this.searchService = searchService;
        this.auditSink = auditSink;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.responseTimeout = properties.responseTimeout();
        this.maxGuards = properties.maxGuards();
    }

    // ----------------------------------------------------------------------------------------
    // Dispatch
    // ----------------------------------------------------------------------------------------

    /**
     * Alerts the first wave of guards for a freshly opened incident.
     *
     * Does nothing when the incident is already assigned or closed, which covers a second
     * dispatch attempt after a raced merge. Guards already alerted for the incident are
     * excluded, so repeating the call never re-alerts anyone.
     *
     * @return alerts issued, empty when the search found nobody
     */
    public List<GuardAlert> dispatchInitialAlerts(Long incidentId, int maxGuards) {
        return inTransaction(() -> {
            Incident incident = lockIncident(incidentId);
            if (!incident.isOpen() || assignmentRepository.existsByIncidentIdAndActiveTrue(incidentId)) {
                log.info("Skipping initial dispatch for {}: already assigned or closed", incident.toLogString());
                return List.of();
            }
            return sendWave(incident, maxGuards, clock.instant());
        });
    }

    /**
     * Sends a fresh wave for an open, unassigned incident, skipping every guard alerted before.
     */
    public List<GuardAlert> redispatch(Long incidentId, SignalActor actor) {
        return inTransaction(() -> {
            Incident incident = lockIncident(incidentId);
            if (!incident.isOpen()) {
                throw new InvalidStatusTransitionException(incidentId, "incident is resolved");
            }
            if (assignmentRepository.existsByIncidentIdAndActiveTrue(incidentId)) {
                throw new InvalidStatusTransitionException(incidentId, "incident already has an active assignment");
            }
            log.info("Redispatch of {} requested by {}", incident.toLogString(), actor.toLogString());
            return sendWave(incident, maxGuards, clock.instant());
        });
    }

    // ----------------------------------------------------------------------------------------
    // Guard responses
    // ----------------------------------------------------------------------------------------

    public AlertResult accept(Long alertId, Long respondingGuardId) {
        try {
            return inTransaction(() -> acceptLocked(alertId, respondingGuardId));
        } catch (DataIntegrityViolationException e) {
            log.warn("Assignment constraint hit while accepting alert {} by guard {}, replaying: {}",
                alertId, respondingGuardId, e.getMostSpecificCause().getMessage());
            return inTransaction(() -> acceptLocked(alertId, respondingGuardId));
        }
    }

    private AlertResult acceptLocked(Long alertId, Long guardId) {
        Incident incident = lockIncidentOfAlert(alertId);
        GuardAlert alert = loadAlert(alertId);
        if (!alert.getGuardId().equals(guardId)) {
            throw new InvalidGuardException(alertId, guardId);
        }

        Optional<GuardAssignment> active = assignmentRepository.findByIncidentIdAndActiveTrue(incident.getId());

        if (!alert.isPending()) {
            if (alert.getStatus() == AlertStatus.EXPIRED
                && active.isPresent() && !active.get().getGuardId().equals(guardId)) {
                log.info("Late accept of {}: incident {} already held by guard {}",
                    alert.toLogString(), incident.getId(), active.get().getGuardId());
                return AlertResult.of(alert, AlertOutcome.ALREADY_ASSIGNED);
            }
            log.debug("Accept ignored, alert no longer pending: {}", alert.toLogString());
            return AlertResult.of(alert, AlertOutcome.STALE_OR_TERMINAL);
        }

        Instant now = clock.instant();

        if (!incident.isOpen()) {
            closeAlert(alert, AlertStatus.EXPIRED, REASON_INCIDENT_CLOSED, guardActor(guardId), now);
            return AlertResult.of(alert, AlertOutcome.INCIDENT_CLOSED);
        }

        if (active.isPresent() && !active.get().getGuardId().equals(guardId)) {
            closeAlert(alert, AlertStatus.EXPIRED, REASON_ALREADY_ASSIGNED, guardActor(guardId), now);
            log.warn("Accept race lost: {} (incident held by guard {})",
                alert.toLogString(), active.get().getGuardId());
            return AlertResult.of(alert, AlertOutcome.ALREADY_ASSIGNED);
        }

        Optional<GuardAssignment> elsewhere = assignmentRepository.findByGuardIdAndActiveTrue(guardId)
            .filter(assignment -> !assignment.getIncidentId().equals(incident.getId()));
        if (elsewhere.isPresent()) {
            closeAlert(alert, AlertStatus.EXPIRED, REASON_GUARD_UNAVAILABLE, guardActor(guardId), now);
            log.warn("Guard {} accepted {} while assigned to incident {}; escalating",
                guardId, incident.toLogString(), elsewhere.get().getIncidentId());
            GuardAlert next = escalate(incident, now);
            return new AlertResult(alert, AlertOutcome.GUARD_UNAVAILABLE, null, next);
        }

        GuardAssignment assignment = active.orElseGet(() -> activateAssignment(incident, guardId, now));

        alert.close(AlertStatus.ACCEPTED, now);
        alert.setAssignmentId(assignment.getId());
        alertRepository.save(alert);
        auditSink.record(AuditEvent.builder()
            .incidentId(incident.getId())
            .type(IncidentEventType.ALERT_ACCEPTED)
            .actorRole(ActorRole.GUARD)
            .actorId(String.valueOf(guardId))
            .targetGuardId(guardId)
            .alertId(alert.getId())
            .details(Map.of("priorityRank", alert.getPriorityRank()))
            .build());

        if (active.isEmpty()) {
            markAssigned(incident, guardId, guardActor(guardId), now);
        }
        standDownPendingAlerts(incident, REASON_ALREADY_ASSIGNED, now);

        publish(assignment.getGuardId(), incident, alert.getId(), NotificationKind.ASSIGNMENT_CONFIRMED,
            Map.of("assignmentId", assignment.getId(), "beaconId", incident.getBeaconId()));
        eventPublisher.publishEvent(IncidentUpdate.of(incident, "ALERT_ACCEPTED"));

        log.info("Alert accepted: {} -> {}", alert.toLogString(), incident.toLogString());
        return new AlertResult(alert, AlertOutcome.ACCEPTED, assignment, null);
    }

    public AlertResult decline(Long alertId, Long respondingGuardId) {
        return inTransaction(() -> {
            Incident incident = lockIncidentOfAlert(alertId);
            GuardAlert alert = loadAlert(alertId);
            if (!alert.getGuardId().equals(respondingGuardId)) {
                throw new InvalidGuardException(alertId, respondingGuardId);
            }
            if (!alert.isPending()) {
                log.debug("Decline ignored, alert no longer pending: {}", alert.toLogString());
                return AlertResult.of(alert, AlertOutcome.STALE_OR_TERMINAL);
            }

            Instant now = clock.instant();
            closeAlert(alert, AlertStatus.DECLINED, null, guardActor(respondingGuardId), now);
            incident.recordDecline();

            GuardAlert next = canEscalate(incident) ? escalate(incident, now) : null;
            incidentRepository.save(incident);

            log.info("Alert declined: {}, escalated to {}",
                alert.toLogString(), next == null ? "nobody" : next.toLogString());
            return new AlertResult(alert, AlertOutcome.DECLINED, null, next);
        });
    }

    /**
     * Expires a SENT alert and escalates like a decline. A no-op on terminal alerts, so the
     * deadline sweeper and a manual call can overlap safely.
     */
    public AlertResult expire(Long alertId) {
        return inTransaction(() -> {
            Incident incident = lockIncidentOfAlert(alertId);
            GuardAlert alert = loadAlert(alertId);
            if (!alert.isPending()) {
                return AlertResult.of(alert, AlertOutcome.STALE_OR_TERMINAL);
            }

            Instant now = clock.instant();
            closeAlert(alert, AlertStatus.EXPIRED, REASON_DEADLINE, SignalActor.system(), now);
            publish(alert.getGuardId(), incident, alert.getId(), NotificationKind.ALERT_WITHDRAWN,
                Map.of("reason", REASON_DEADLINE));

            GuardAlert next = canEscalate(incident) ? escalate(incident, now) : null;
            if (next != null) {
                incidentRepository.save(incident);
            }

            log.info("Alert expired: {}, escalated to {}",
                alert.toLogString(), next == null ? "nobody" : next.toLogString());
            return new AlertResult(alert, AlertOutcome.EXPIRED, null, next);
        });
    }

    /**
     * Expires every SENT alert past its deadline. Each alert gets its own transaction; one
     * failure is logged and counted and the sweep moves on.
     */
    public EscalationSummary expireOverdueAlerts() {
        List<GuardAlert> overdue = alertRepository.findOverdue(clock.instant());
        int escalated = 0;
        int exhausted = 0;
        int failed = 0;

        for (GuardAlert alert : overdue) {
            try {
                AlertResult result = expire(alert.getId());
                if (result.outcome() != AlertOutcome.EXPIRED) {
                    continue;
                }
                if (result.escalated()) {
                    escalated++;
                } else {
                    exhausted++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to expire overdue alert {}", alert.toLogString(), e);
            }
        }

        EscalationSummary summary = new EscalationSummary(escalated, exhausted, failed);
        if (summary.total() > 0) {
            log.info("Expiry sweep: {} escalated, {} exhausted, {} failed", escalated, exhausted, failed);
        }
        return summary;
    }

    // ----------------------------------------------------------------------------------------
    // Incident transitions
    // ----------------------------------------------------------------------------------------

    /**
     * ASSIGNED -> IN_PROGRESS, by the assigned guard only.
     */
    public Incident startResponse(Long incidentId, Long guardId) {
        return inTransaction(() -> {
            Incident incident = lockIncident(incidentId);
            if (incident.getStatus() != IncidentStatus.ASSIGNED) {
                throw new InvalidStatusTransitionException(incidentId, incident.getStatus(), IncidentStatus.IN_PROGRESS);
            }
            if (!guardId.equals(incident.getCurrentAssignedGuardId())) {
                throw InvalidGuardException.notAssigned(incidentId, guardId);
            }

            SignalActor actor = guardActor(guardId);
            transition(incident, IncidentStatus.IN_PROGRESS, actor);
            auditSink.record(actorEvent(incident, IncidentEventType.RESOLUTION_STARTED, actor)
                .targetGuardId(guardId)
                .build());
            Incident saved = incidentRepository.save(incident);
            eventPublisher.publishEvent(IncidentUpdate.of(saved, "RESOLUTION_STARTED"));
            log.info("Response started: {}", saved.toLogString());
            return saved;
        });
    }

    /**
     * Closes an incident: deactivates its assignment, withdraws pending alerts and frees the
     * beacon for the next incident. A guard may only resolve the incident assigned to them.
     */
    public Incident resolveIncident(Long incidentId, SignalActor actor, String notes, ResolutionType type) {
        if (notes == null || notes.isBlank()) {
            throw new IllegalArgumentException("Resolution notes are required");
        }
        return inTransaction(() -> {
            Incident incident = lockIncident(incidentId);
            if (!incident.isOpen()) {
                throw new InvalidStatusTransitionException(incidentId, incident.getStatus(), IncidentStatus.RESOLVED);
            }
            if (actor.role() == ActorRole.GUARD
                && !String.valueOf(incident.getCurrentAssignedGuardId()).equals(actor.actorId())) {
                throw InvalidGuardException.notAssigned(incidentId, actor.actorId());
            }

            Instant now = clock.instant();
            assignmentRepository.findByIncidentIdAndActiveTrue(incidentId)
                .ifPresent(assignment -> {
                    assignment.deactivate("RESOLVED", now);
                    assignmentRepository.save(assignment);
                });
            standDownPendingAlerts(incident, REASON_INCIDENT_CLOSED, now);

            IncidentStatus previous = incident.getStatus();
            ResolutionType resolutionType = type == null ? ResolutionType.RESOLVED_BY_GUARD : type;
            incident.markResolved(actor.actorId(), notes, resolutionType, now);
            Incident saved = incidentRepository.save(incident);

            auditSink.record(actorEvent(saved, IncidentEventType.STATUS_CHANGED, actor)
                .previousStatus(previous)
                .newStatus(IncidentStatus.RESOLVED)
                .build());
            auditSink.record(actorEvent(saved, IncidentEventType.INCIDENT_RESOLVED, actor)
                .targetGuardId(saved.getCurrentAssignedGuardId())
                .details(Map.of("resolutionType", resolutionType.name(), "notes", notes))
                .build());
            eventPublisher.publishEvent(IncidentUpdate.of(saved, "INCIDENT_RESOLVED"));

            log.info("Incident resolved by {}: {}", actor.toLogString(), saved.toLogString());
            return saved;
        });
    }

    /**
     * Assigns a guard directly, bypassing the alert race. An existing assignment to another
     * guard is revoked first; pending alerts are withdrawn, except the assigned guard's own,
     * which is marked ACCEPTED.
     */
    public GuardAssignment assignGuard(Long incidentId, Long guardId, SignalActor actor) {
        try {
            return inTransaction(() -> assignLocked(incidentId, guardId, actor));
        } catch (DataIntegrityViolationException e) {
            log.warn("Assignment constraint hit while assigning guard {} to incident {}, replaying",
                guardId, incidentId);
            return inTransaction(() -> assignLocked(incidentId, guardId, actor));
        }
    }

    private GuardAssignment assignLocked(Long incidentId, Long guardId, SignalActor actor) {
        Incident incident = lockIncident(incidentId);
        if (!incident.isOpen()) {
            throw new InvalidStatusTransitionException(incidentId, incident.getStatus(), IncidentStatus.ASSIGNED);
        }
        guardRepository.findById(guardId).orElseThrow(() -> new GuardNotFoundException(guardId));

        Optional<GuardAssignment> active = assignmentRepository.findByIncidentIdAndActiveTrue(incidentId);
        if (active.isPresent() && active.get().getGuardId().equals(guardId)) {
            return active.get();
        }

        Optional<GuardAssignment> elsewhere = assignmentRepository.findByGuardIdAndActiveTrue(guardId);
        if (elsewhere.isPresent()) {
            throw new GuardUnavailableException(guardId, elsewhere.get().getIncidentId());
        }

        Instant now = clock.instant();
        active.ifPresent(previous -> revoke(incident, previous, "REASSIGNED", actor, now));

        GuardAssignment assignment = activateAssignment(incident, guardId, now);
        for (GuardAlert pending : alertRepository.findByIncidentIdAndStatusOrderByPriorityRankAsc(
                incidentId, AlertStatus.SENT)) {
            if (pending.getGuardId().equals(guardId)) {
                pending.close(AlertStatus.ACCEPTED, now);
                pending.setAssignmentId(assignment.getId());
                alertRepository.save(pending);
            }
        }
        standDownPendingAlerts(incident, REASON_MANUAL_ASSIGNMENT, now);
        markAssigned(incident, guardId, actor, now);

        publish(guardId, incident, null, NotificationKind.ASSIGNMENT_CONFIRMED,
            Map.of("assignmentId", assignment.getId(), "beaconId", incident.getBeaconId()));
        eventPublisher.publishEvent(IncidentUpdate.of(incident, "GUARD_ASSIGNED"));

        log.info("Guard {} assigned to {} by {}", guardId, incident.toLogString(), actor.toLogString());
        return assignment;
    }

    /**
     * Revokes the active assignment and returns the incident to CREATED. No new alerts are
     * sent; use {@link #redispatch(Long, SignalActor)} for that.
     */
    public Incident unassignGuard(Long incidentId, SignalActor actor) {
        return inTransaction(() -> {
            Incident incident = lockIncident(incidentId);
            GuardAssignment active = assignmentRepository.findByIncidentIdAndActiveTrue(incidentId)
                .orElseThrow(() -> new InvalidStatusTransitionException(incidentId, "no active assignment"));

            revoke(incident, active, "UNASSIGNED", actor, clock.instant());
            Incident saved = incidentRepository.save(incident);
            eventPublisher.publishEvent(IncidentUpdate.of(saved, "GUARD_UNASSIGNED"));
            log.info("Guard {} unassigned from {} by {}", active.getGuardId(), saved.toLogString(), actor.toLogString());
            return saved;
        });
    }

    // ----------------------------------------------------------------------------------------
    // Internals; all callers hold the incident lock
    // ----------------------------------------------------------------------------------------

    private List<GuardAlert> sendWave(Incident incident, int limit, Instant now) {
        List<Long> alerted = alertRepository.findAlertedGuardIds(incident.getId());
        List<DispatchCandidate> candidates = searchService.findCandidateGuards(incident.getBeaconId(), limit, alerted);

        if (candidates.isEmpty()) {
            recordExhausted(incident, "no candidate guards reachable from beacon");
            return List.of();
        }

        int rank = alertRepository.findMaxPriorityRank(incident.getId());
        List<GuardAlert> issued = new ArrayList<>(candidates.size());
        for (DispatchCandidate candidate : candidates) {
            issued.add(issueAlert(incident, candidate, ++rank, now));
        }
        incident.recordAlertsSent(issued.size());
        incidentRepository.save(incident);

        log.info("Dispatched {} alert(s) for {}", issued.size(), incident.toLogString());
        return issued;
    }

    private boolean canEscalate(Incident incident) {
        return incident.isOpen() && !assignmentRepository.existsByIncidentIdAndActiveTrue(incident.getId());
    }

    /**
     * Issues one alert to the next guard not yet alerted for the incident. The search restarts
     * from the incident beacon; exclusion of every guard alerted so far keeps it moving outwards.
     */
    private GuardAlert escalate(Incident incident, Instant now) {
        List<Long> alerted = alertRepository.findAlertedGuardIds(incident.getId());
        List<DispatchCandidate> next = searchService.findCandidateGuards(incident.getBeaconId(), 1, alerted);

        if (next.isEmpty()) {
            if (alertRepository.countByIncidentIdAndStatus(incident.getId(), AlertStatus.SENT) == 0) {
                recordExhausted(incident, "all reachable guards alerted");
            }
            return null;
        }

        int rank = alertRepository.findMaxPriorityRank(incident.getId()) + 1;
        GuardAlert alert = issueAlert(incident, next.get(0), rank, now);
        incident.recordAlertsSent(1);
        return alert;
    }

    private GuardAlert issueAlert(Incident incident, DispatchCandidate candidate, int rank, Instant now) {
        Instant deadline = now.plus(responseTimeout);
        GuardAlert alert = alertRepository.save(GuardAlert.builder()
            .incidentId(incident.getId())
            .guardId(candidate.guardId())
            .status(AlertStatus.SENT)
            .priorityRank(rank)
            .viaBeaconId(candidate.viaBeaconId())
            .hopPriority(candidate.hopPriority())
            .responseDeadline(deadline)
            .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("priorityRank", rank);
        details.put("viaBeaconId", candidate.viaBeaconId());
        details.put("hopPriority", candidate.hopPriority());
        details.put("route", candidate.route());
        auditSink.record(AuditEvent.builder()
            .incidentId(incident.getId())
            .type(IncidentEventType.ALERT_SENT)
            .actorRole(ActorRole.SYSTEM)
            .targetGuardId(candidate.guardId())
            .alertId(alert.getId())
            .details(details)
            .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("beaconId", incident.getBeaconId());
        payload.put("priority", incident.getPriority().name());
        payload.put("description", incident.getDescription());
        payload.put("priorityRank", rank);
        payload.put("viaBeaconId", candidate.viaBeaconId());
        payload.put("hopPriority", candidate.hopPriority());
        payload.put("responseDeadline", deadline.toString());
        publish(candidate.guardId(), incident, alert.getId(), NotificationKind.INCIDENT_ALERT, payload);

        log.info("Alert sent: {} via beacon {} (hop priority {})",
            alert.toLogString(), candidate.viaBeaconId(), candidate.hopPriority());
        return alert;
    }

    private GuardAssignment activateAssignment(Incident incident, Long guardId, Instant now) {
        GuardAssignment assignment = assignmentRepository
            .findFirstByIncidentIdAndGuardIdOrderByIdDesc(incident.getId(), guardId)
            .orElseGet(() -> GuardAssignment.builder()
                .incidentId(incident.getId())
                .guardId(guardId)
                .build());
        assignment.activate(now);
        // Flush now so a unique-constraint violation surfaces here and not at commit.
        return assignmentRepository.saveAndFlush(assignment);
    }

    private void markAssigned(Incident incident, Long guardId, SignalActor actor, Instant now) {
        transition(incident, IncidentStatus.ASSIGNED, actor);
        incident.setCurrentAssignedGuardId(guardId);
        incident.setAssignedAt(now);
        incidentRepository.save(incident);
        auditSink.record(actorEvent(incident, IncidentEventType.GUARD_ASSIGNED, actor)
            .targetGuardId(guardId)
            .build());
    }

    private void revoke(Incident incident, GuardAssignment assignment, String reason, SignalActor actor, Instant now) {
        assignment.deactivate(reason, now);
        assignmentRepository.saveAndFlush(assignment);

        transition(incident, IncidentStatus.CREATED, actor);
        incident.setCurrentAssignedGuardId(null);
        incident.setAssignedAt(null);

        auditSink.record(actorEvent(incident, IncidentEventType.GUARD_UNASSIGNED, actor)
            .targetGuardId(assignment.getGuardId())
            .details(Map.of("reason", reason))
            .build());
        publish(assignment.getGuardId(), incident, null, NotificationKind.ASSIGNMENT_REVOKED,
            Map.of("reason", reason));
    }

    private void standDownPendingAlerts(Incident incident, String reason, Instant now) {
        for (GuardAlert rival : alertRepository.findByIncidentIdAndStatusOrderByPriorityRankAsc(
                incident.getId(), AlertStatus.SENT)) {
            closeAlert(rival, AlertStatus.EXPIRED, reason, SignalActor.system(), now);
            publish(rival.getGuardId(), incident, rival.getId(), NotificationKind.ALERT_WITHDRAWN,
                Map.of("reason", reason));
        }
    }

    private void closeAlert(GuardAlert alert, AlertStatus terminal, String reason, SignalActor actor, Instant now) {
        alert.close(terminal, now);
        alertRepository.save(alert);

        IncidentEventType type = switch (terminal) {
            case ACCEPTED -> IncidentEventType.ALERT_ACCEPTED;
            case DECLINED -> IncidentEventType.ALERT_DECLINED;
            case EXPIRED -> IncidentEventType.ALERT_EXPIRED;
            case SENT -> throw new IllegalStateException("SENT is not terminal");
        };
        AuditEvent.AuditEventBuilder event = AuditEvent.builder()
            .incidentId(alert.getIncidentId())
            .type(type)
            .actorRole(actor.role())
            .actorId(actor.actorId())
            .targetGuardId(alert.getGuardId())
            .alertId(alert.getId());
        if (reason != null) {
            event.details(Map.of("reason", reason, "priorityRank", alert.getPriorityRank()));
        } else {
            event.details(Map.of("priorityRank", alert.getPriorityRank()));
        }
        auditSink.record(event.build());
    }

    private void transition(Incident incident, IncidentStatus target, SignalActor actor) {
        IncidentStatus previous = incident.getStatus();
        if (!previous.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(incident.getId(), previous, target);
        }
        incident.setStatus(target);
        auditSink.record(actorEvent(incident, IncidentEventType.STATUS_CHANGED, actor)
            .previousStatus(previous)
            .newStatus(target)
            .build());
    }

    private void recordExhausted(Incident incident, String reason) {
        log.warn("No candidate guards for {}: {}", incident.toLogString(), reason);
        auditSink.record(AuditEvent.builder()
            .incidentId(incident.getId())
            .type(IncidentEventType.ALL_GUARDS_EXHAUSTED)
            .actorRole(ActorRole.SYSTEM)
            .details(Map.of("reason", reason))
            .build());
    }

    private void publish(Long guardId, Incident incident, Long alertId, NotificationKind kind, Map<String, Object> payload) {
        eventPublisher.publishEvent(new GuardNotification(guardId, incident.getId(), alertId, kind, payload));
    }

    private AuditEvent.AuditEventBuilder actorEvent(Incident incident, IncidentEventType type, SignalActor actor) {
        return AuditEvent.builder()
            .incidentId(incident.getId())
            .type(type)
            .actorRole(actor.role())
            .actorId(actor.actorId());
    }

    private Incident lockIncident(Long incidentId) {
        return incidentRepository.findByIdForUpdate(incidentId)
            .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    private Incident lockIncidentOfAlert(Long alertId) {
        Long incidentId = alertRepository.findIncidentIdById(alertId)
            .orElseThrow(() -> new AlertNotFoundException(alertId));
        return lockIncident(incidentId);
    }

    private GuardAlert loadAlert(Long alertId) {
        return alertRepository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    private static SignalActor guardActor(Long guardId) {
        return SignalActor.guard(guardId);
    }

    private <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
