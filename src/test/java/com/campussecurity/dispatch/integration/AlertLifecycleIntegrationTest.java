package com.campussecurity.dispatch.integration;

import com.campussecurity.dispatch.dto.AlertOutcome;
import com.campussecurity.dispatch.dto.AlertResult;
import com.campussecurity.dispatch.dto.DispatchResult;
import com.campussecurity.dispatch.dto.EscalationSummary;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardAssignment;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.entity.ResolutionType;
import com.campussecurity.dispatch.exception.GuardUnavailableException;
import com.campussecurity.dispatch.exception.InvalidGuardException;
import com.campussecurity.dispatch.exception.InvalidStatusTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Campus layout used throughout:
 *
 * <pre>
 *   O --(1)--> B1      g1, g2 at O
 *   O --(2)--> B2      g3 at B1, g4 at B2
 * </pre>
 *
 * With three guards per wave, an incident at O alerts g1, g2 and g3; g4 is the first
 * escalation target.
 */
@DisplayName("Alert lifecycle")
class AlertLifecycleIntegrationTest extends DispatchIntegrationSupport {

    private Beacon origin;
    private Beacon sameFloor;
    private Beacon nextFloor;
    private GuardProfile g1;
    private GuardProfile g2;
    private GuardProfile g3;
    private GuardProfile g4;

    @BeforeEach
    void campus() {
        origin = beacon("safe:uuid:O");
        sameFloor = beacon("safe:uuid:B1");
        nextFloor = beacon("safe:uuid:B2");
        edge(origin, sameFloor, 1);
        edge(origin, nextFloor, 2);

        g1 = guardAt("Guard One", origin);
        g2 = guardAt("Guard Two", origin);
        g3 = guardAt("Guard Three", sameFloor);
        g4 = guardAt("Guard Four", nextFloor);
    }

    private Long openIncident() {
        DispatchResult result = sos(origin, "student-1");
        assertThat(result.wasCreated()).isTrue();
        return result.incident().getId();
    }

    private Incident reload(Long incidentId) {
        return incidentRepository.findById(incidentId).orElseThrow();
    }

    @Test
    @DisplayName("The first wave goes to the nearest guards in search order")
    void shouldAlertFirstWaveInSearchOrder() {
        // When
        Long incidentId = openIncident();

        // Then
        List<GuardAlert> alerts = alertsOf(incidentId);
        assertThat(alerts).extracting(GuardAlert::getGuardId).containsExactly(g1.getId(), g2.getId(), g3.getId());
        assertThat(alerts).extracting(GuardAlert::getPriorityRank).containsExactly(1, 2, 3);
        assertThat(alerts).extracting(GuardAlert::getHopPriority).containsExactly(0, 0, 1);
        assertThat(alerts).allMatch(alert -> alert.getResponseDeadline() != null);
        assertThat(events(incidentId, IncidentEventType.ALERT_SENT)).isEqualTo(3);
        assertThat(reload(incidentId).getTotalAlertsSent()).isEqualTo(3);
    }

    @Nested
    @DisplayName("Decline and expiry")
    class DeclineAndExpiry {

        @Test
        @DisplayName("A decline escalates to the next guard not yet alerted, with the next rank")
        void shouldEscalateOnDecline() {
            // Given
            Long incidentId = openIncident();

            // When
            AlertResult result = alertLifecycleManager.decline(alertFor(incidentId, g1.getId()).getId(), g1.getId());

            // Then
            assertThat(result.outcome()).isEqualTo(AlertOutcome.DECLINED);
            assertThat(result.alert().getStatus()).isEqualTo(AlertStatus.DECLINED);
            assertThat(result.escalatedAlert()).isNotNull();
            assertThat(result.escalatedAlert().getGuardId()).isEqualTo(g4.getId());
            assertThat(result.escalatedAlert().getPriorityRank()).isEqualTo(4);
            assertThat(result.escalatedAlert().getViaBeaconId()).isEqualTo(nextFloor.getId());
            assertThat(result.escalatedAlert().getHopPriority()).isEqualTo(2);
            assertThat(reload(incidentId).getTotalAlertsDeclined()).isEqualTo(1);
        }

        @Test
        @DisplayName("Exhaustion is audited once, when the last pending alert is declined")
        void shouldAuditExhaustionOnce() {
            // Given
            Long incidentId = openIncident();
            alertLifecycleManager.decline(alertFor(incidentId, g1.getId()).getId(), g1.getId());

            // When
            AlertResult second = alertLifecycleManager.decline(alertFor(incidentId, g2.getId()).getId(), g2.getId());
            alertLifecycleManager.decline(alertFor(incidentId, g3.getId()).getId(), g3.getId());
            AlertResult last = alertLifecycleManager.decline(alertFor(incidentId, g4.getId()).getId(), g4.getId());

            // Then
            assertThat(second.escalated()).isFalse();
            assertThat(last.escalated()).isFalse();
            assertThat(pendingAlerts(incidentId)).isZero();
            assertThat(events(incidentId, IncidentEventType.ALL_GUARDS_EXHAUSTED)).isEqualTo(1);
            assertThat(reload(incidentId).getStatus()).isEqualTo(IncidentStatus.CREATED);
        }

        @Test
        @DisplayName("Expiring an alert twice escalates only once")
        void shouldExpireIdempotently() {
            // Given
            Long incidentId = openIncident();
            Long alertId = alertFor(incidentId, g1.getId()).getId();

            // When
            AlertResult first = alertLifecycleManager.expire(alertId);
            AlertResult second = alertLifecycleManager.expire(alertId);

            // Then
            assertThat(first.outcome()).isEqualTo(AlertOutcome.EXPIRED);
            assertThat(first.escalatedAlert().getGuardId()).isEqualTo(g4.getId());
            assertThat(second.outcome()).isEqualTo(AlertOutcome.STALE_OR_TERMINAL);
            assertThat(second.escalated()).isFalse();
            assertThat(alertsOf(incidentId)).hasSize(4);
            assertThat(events(incidentId, IncidentEventType.ALERT_EXPIRED)).isEqualTo(1);
        }

        @Test
        @DisplayName("The deadline sweep expires overdue alerts and escalates them")
        void shouldSweepOverdueAlerts() {
            // Given
            Long incidentId = openIncident();
            GuardAlert overdue = alertFor(incidentId, g1.getId());
            overdue.setResponseDeadline(Instant.now().minus(1, ChronoUnit.MINUTES));
            alertRepository.save(overdue);

            // When
            EscalationSummary summary = alertLifecycleManager.expireOverdueAlerts();

            // Then
            assertThat(summary.escalated()).isEqualTo(1);
            assertThat(summary.exhausted()).isZero();
            assertThat(summary.failed()).isZero();
            assertThat(alertRepository.findById(overdue.getId()).orElseThrow().getStatus())
                .isEqualTo(AlertStatus.EXPIRED);
            assertThat(alertFor(incidentId, g4.getId()).getStatus()).isEqualTo(AlertStatus.SENT);
            assertThat(alertLifecycleManager.expireOverdueAlerts().total()).isZero();
        }
    }

    @Nested
    @DisplayName("Accept")
    class Accept {

        @Test
        @DisplayName("Accepting assigns the guard and stands down the other pending alerts")
        void shouldAssignOnAccept() {
            // Given
            Long incidentId = openIncident();

            // When
            AlertResult result = alertLifecycleManager.accept(alertFor(incidentId, g2.getId()).getId(), g2.getId());

            // Then
            assertThat(result.outcome()).isEqualTo(AlertOutcome.ACCEPTED);
            assertThat(result.assignment().getGuardId()).isEqualTo(g2.getId());
            assertThat(result.alert().getAssignmentId()).isEqualTo(result.assignment().getId());

            Incident incident = reload(incidentId);
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.ASSIGNED);
            assertThat(incident.getCurrentAssignedGuardId()).isEqualTo(g2.getId());
            assertThat(alertFor(incidentId, g1.getId()).getStatus()).isEqualTo(AlertStatus.EXPIRED);
            assertThat(alertFor(incidentId, g3.getId()).getStatus()).isEqualTo(AlertStatus.EXPIRED);
            assertThat(pendingAlerts(incidentId)).isZero();
        }

        @Test
        @DisplayName("Concurrent accepts: exactly one guard wins, the other is told it was already assigned")
        void shouldLetOnlyOneConcurrentAcceptWin() throws Exception {
            // Given
            Long incidentId = openIncident();
            Long alert1 = alertFor(incidentId, g1.getId()).getId();
            Long alert2 = alertFor(incidentId, g2.getId()).getId();
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);

            try {
                // When
                Callable<AlertResult> accept1 = () -> {
                    start.await();
                    return alertLifecycleManager.accept(alert1, g1.getId());
                };
                Callable<AlertResult> accept2 = () -> {
                    start.await();
                    return alertLifecycleManager.accept(alert2, g2.getId());
                };
                Future<AlertResult> first = executor.submit(accept1);
                Future<AlertResult> second = executor.submit(accept2);
                start.countDown();

                List<AlertOutcome> outcomes = List.of(
                    first.get(30, TimeUnit.SECONDS).outcome(),
                    second.get(30, TimeUnit.SECONDS).outcome());

                // Then
                assertThat(outcomes).containsExactlyInAnyOrder(AlertOutcome.ACCEPTED, AlertOutcome.ALREADY_ASSIGNED);
                assertThat(assignmentRepository.countByIncidentIdAndActiveTrue(incidentId)).isEqualTo(1);
                assertThat(alertRepository.countByIncidentIdAndStatus(incidentId, AlertStatus.ACCEPTED)).isEqualTo(1);

                Long winner = reload(incidentId).getCurrentAssignedGuardId();
                Long loser = winner.equals(g1.getId()) ? g2.getId() : g1.getId();
                assertThat(alertFor(incidentId, loser).getStatus()).isEqualTo(AlertStatus.EXPIRED);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Only the alerted guard may respond to an alert")
        void shouldRejectWrongGuard() {
            // Given
            Long incidentId = openIncident();
            Long alertId = alertFor(incidentId, g1.getId()).getId();

            // When / Then
            assertThatThrownBy(() -> alertLifecycleManager.accept(alertId, g2.getId()))
                .isInstanceOf(InvalidGuardException.class);
            assertThatThrownBy(() -> alertLifecycleManager.decline(alertId, g3.getId()))
                .isInstanceOf(InvalidGuardException.class);
            assertThat(pendingAlerts(incidentId)).isEqualTo(3);
        }

        @Test
        @DisplayName("Accepting an alert that was already declined changes nothing")
        void shouldIgnoreStaleAccept() {
            // Given
            Long incidentId = openIncident();
            Long alertId = alertFor(incidentId, g1.getId()).getId();
            alertLifecycleManager.decline(alertId, g1.getId());

            // When
            AlertResult result = alertLifecycleManager.accept(alertId, g1.getId());

            // Then
            assertThat(result.outcome()).isEqualTo(AlertOutcome.STALE_OR_TERMINAL);
            assertThat(result.changedState()).isFalse();
            assertThat(assignmentRepository.existsByIncidentIdAndActiveTrue(incidentId)).isFalse();
        }

        @Test
        @DisplayName("A guard already holding one incident cannot accept another; the second escalates")
        void shouldReportGuardUnavailable() {
            // Given
            Beacon quad = beacon("safe:uuid:Q");
            edge(quad, origin, 1);
            Long first = openIncident();
            Long second = sos(quad, "student-2").incident().getId();
            assertThat(alertsOf(second)).extracting(GuardAlert::getGuardId)
                .containsExactly(g1.getId(), g2.getId(), g3.getId());
            alertLifecycleManager.accept(alertFor(first, g1.getId()).getId(), g1.getId());

            // When
            AlertResult result = alertLifecycleManager.accept(alertFor(second, g1.getId()).getId(), g1.getId());

            // Then
            assertThat(result.outcome()).isEqualTo(AlertOutcome.GUARD_UNAVAILABLE);
            assertThat(result.alert().getStatus()).isEqualTo(AlertStatus.EXPIRED);
            assertThat(result.escalatedAlert().getGuardId()).isEqualTo(g4.getId());
            assertThat(reload(second).getStatus()).isEqualTo(IncidentStatus.CREATED);
            assertThat(assignmentRepository.findByGuardIdAndActiveTrue(g1.getId()).orElseThrow().getIncidentId())
                .isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Incident transitions")
    class Transitions {

        @Test
        @DisplayName("The assigned guard starts the response and resolves the incident")
        void shouldStartAndResolve() {
            // Given
            Long incidentId = openIncident();
            alertLifecycleManager.accept(alertFor(incidentId, g1.getId()).getId(), g1.getId());

            // When
            Incident started = alertLifecycleManager.startResponse(incidentId, g1.getId());
            Incident resolved = alertLifecycleManager.resolveIncident(
                incidentId, SignalActor.guard(g1.getId()), "Student escorted to clinic", null);

            // Then
            assertThat(started.getStatus()).isEqualTo(IncidentStatus.IN_PROGRESS);
            assertThat(resolved.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(resolved.getResolutionType()).isEqualTo(ResolutionType.RESOLVED_BY_GUARD);
            assertThat(resolved.getResolutionNotes()).isEqualTo("Student escorted to clinic");
            assertThat(resolved.getOpenBeaconId()).isNull();
            assertThat(assignmentRepository.existsByIncidentIdAndActiveTrue(incidentId)).isFalse();
            assertThat(events(incidentId, IncidentEventType.RESOLUTION_STARTED)).isEqualTo(1);
            assertThat(events(incidentId, IncidentEventType.INCIDENT_RESOLVED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Start and resolve are refused to guards not assigned, and in the wrong state")
        void shouldGuardTransitions() {
            // Given
            Long incidentId = openIncident();

            // When / Then
            assertThatThrownBy(() -> alertLifecycleManager.startResponse(incidentId, g1.getId()))
                .isInstanceOf(InvalidStatusTransitionException.class);

            alertLifecycleManager.accept(alertFor(incidentId, g1.getId()).getId(), g1.getId());
            assertThatThrownBy(() -> alertLifecycleManager.startResponse(incidentId, g2.getId()))
                .isInstanceOf(InvalidGuardException.class);
            assertThatThrownBy(() -> alertLifecycleManager.resolveIncident(
                incidentId, SignalActor.guard(g2.getId()), "Not mine", null))
                .isInstanceOf(InvalidGuardException.class);
            assertThatThrownBy(() -> alertLifecycleManager.resolveIncident(
                incidentId, SignalActor.guard(g1.getId()), "  ", null))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(reload(incidentId).getStatus()).isEqualTo(IncidentStatus.ASSIGNED);
        }

        @Test
        @DisplayName("A resolved incident cannot be resolved again, and late accepts do nothing")
        void shouldKeepResolvedTerminal() {
            // Given
            Long incidentId = openIncident();
            Long lateAlert = alertFor(incidentId, g3.getId()).getId();
            alertLifecycleManager.resolveIncident(incidentId, SignalActor.admin("admin-1"), "Handled by police",
                ResolutionType.ESCALATED_TO_ADMIN);

            // When / Then
            assertThatThrownBy(() -> alertLifecycleManager.resolveIncident(
                incidentId, SignalActor.admin("admin-1"), "Again", null))
                .isInstanceOf(InvalidStatusTransitionException.class);
            assertThat(alertLifecycleManager.accept(lateAlert, g3.getId()).outcome())
                .isEqualTo(AlertOutcome.STALE_OR_TERMINAL);
            assertThat(pendingAlerts(incidentId)).isZero();
            assertThat(assignmentRepository.existsByIncidentIdAndActiveTrue(incidentId)).isFalse();
        }

        @Test
        @DisplayName("An admin assignment withdraws pending alerts and marks the guard's own alert accepted")
        void shouldAssignManually() {
            // Given
            Long incidentId = openIncident();

            // When
            GuardAssignment assignment = alertLifecycleManager.assignGuard(
                incidentId, g2.getId(), SignalActor.admin("admin-1"));

            // Then
            assertThat(assignment.isActive()).isTrue();
            assertThat(reload(incidentId).getStatus()).isEqualTo(IncidentStatus.ASSIGNED);
            assertThat(alertFor(incidentId, g2.getId()).getStatus()).isEqualTo(AlertStatus.ACCEPTED);
            assertThat(alertFor(incidentId, g1.getId()).getStatus()).isEqualTo(AlertStatus.EXPIRED);
            assertThat(alertFor(incidentId, g3.getId()).getStatus()).isEqualTo(AlertStatus.EXPIRED);

            // repeating the same assignment is a no-op
            GuardAssignment again = alertLifecycleManager.assignGuard(
                incidentId, g2.getId(), SignalActor.admin("admin-1"));
            assertThat(again.getId()).isEqualTo(assignment.getId());
        }

        @Test
        @DisplayName("Reassignment revokes the previous guard; a guard busy elsewhere is refused")
        void shouldReassign() {
            // Given
            Long incidentId = openIncident();
            alertLifecycleManager.accept(alertFor(incidentId, g1.getId()).getId(), g1.getId());

            // When
            alertLifecycleManager.assignGuard(incidentId, g4.getId(), SignalActor.admin("admin-1"));

            // Then
            assertThat(reload(incidentId).getCurrentAssignedGuardId()).isEqualTo(g4.getId());
            assertThat(assignmentRepository.findByGuardIdAndActiveTrue(g1.getId())).isEmpty();
            assertThat(assignmentRepository.countByIncidentIdAndActiveTrue(incidentId)).isEqualTo(1);
            assertThat(events(incidentId, IncidentEventType.GUARD_UNASSIGNED)).isEqualTo(1);

            Beacon annex = beacon("safe:uuid:annex");
            Long other = sos(annex, "student-3").incident().getId();
            assertThatThrownBy(() -> alertLifecycleManager.assignGuard(other, g4.getId(), SignalActor.admin("admin-1")))
                .isInstanceOf(GuardUnavailableException.class);
        }

        @Test
        @DisplayName("Unassigning returns the incident to CREATED; redispatch alerts only guards not alerted before")
        void shouldUnassignAndRedispatch() {
            // Given
            Long incidentId = openIncident();
            alertLifecycleManager.accept(alertFor(incidentId, g1.getId()).getId(), g1.getId());
            assertThatThrownBy(() -> alertLifecycleManager.redispatch(incidentId, SignalActor.admin("admin-1")))
                .isInstanceOf(InvalidStatusTransitionException.class);

            // When
            Incident unassigned = alertLifecycleManager.unassignGuard(incidentId, SignalActor.admin("admin-1"));
            List<GuardAlert> wave = alertLifecycleManager.redispatch(incidentId, SignalActor.admin("admin-1"));

            // Then
            assertThat(unassigned.getStatus()).isEqualTo(IncidentStatus.CREATED);
            assertThat(unassigned.getCurrentAssignedGuardId()).isNull();
            assertThat(wave).extracting(GuardAlert::getGuardId).containsExactly(g4.getId());
            assertThat(wave.get(0).getPriorityRank()).isEqualTo(4);
            assertThatThrownBy(() -> alertLifecycleManager.unassignGuard(incidentId, SignalActor.admin("admin-1")))
                .isInstanceOf(InvalidStatusTransitionException.class);
        }
    }
}
