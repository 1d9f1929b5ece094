package com.campussecurity.dispatch.integration;

import com.campussecurity.dispatch.dto.DispatchResult;
import com.campussecurity.dispatch.dto.GuardNotification;
import com.campussecurity.dispatch.dto.NotificationKind;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.dto.SignalCommand;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.DeviceType;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentPriority;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.entity.ResolutionType;
import com.campussecurity.dispatch.entity.SignalType;
import com.campussecurity.dispatch.exception.NotificationDeliveryException;
import com.campussecurity.dispatch.exception.UnknownOrInactiveBeaconException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("Incident deduplication")
class IncidentDedupIntegrationTest extends DispatchIntegrationSupport {

    @Test
    @DisplayName("Concurrent signals at one beacon produce exactly one incident")
    void shouldCollapseConcurrentSignalsIntoOneIncident() throws Exception {
        // Given
        Beacon library = beacon("safe:uuid:403:403");
        int signals = 5;
        ExecutorService executor = Executors.newFixedThreadPool(signals);
        CountDownLatch start = new CountDownLatch(1);

        // When
        List<Future<DispatchResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < signals; i++) {
                String studentId = "student-" + i;
                Callable<DispatchResult> task = () -> {
                    start.await();
                    return sos(library, studentId);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<DispatchResult> results = new ArrayList<>();
            for (Future<DispatchResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            // Then
            Set<Long> incidentIds = results.stream()
                .map(result -> result.incident().getId())
                .collect(Collectors.toSet());
            assertThat(incidentIds).hasSize(1);
            assertThat(results).filteredOn(DispatchResult::wasCreated).hasSize(1);

            Long incidentId = incidentIds.iterator().next();
            assertThat(incidentRepository.countByBeaconIdAndStatusIn(library.getId(), IncidentStatus.OPEN))
                .isEqualTo(1);
            assertThat(signalRepository.countByIncidentId(incidentId)).isEqualTo(signals);
            assertThat(events(incidentId, IncidentEventType.INCIDENT_CREATED)).isEqualTo(1);
            assertThat(events(incidentId, IncidentEventType.SIGNAL_MERGED)).isEqualTo(signals - 1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A panic button at the same beacon merges into the SOS incident and raises it to CRITICAL")
    void shouldMergePanicIntoSosAndRaisePriority() {
        // Given
        Beacon library = beacon("safe:uuid:403:403");
        device("ESP32-001", DeviceType.PANIC_BUTTON, library);
        DispatchResult first = sos(library, "student-1");

        // When
        DispatchResult second = orchestrator.handlePanicButton("ESP32-001", Map.of("battery", 87));

        // Then
        assertThat(first.wasCreated()).isTrue();
        assertThat(first.incident().getPriority()).isEqualTo(IncidentPriority.MEDIUM);
        assertThat(second.wasCreated()).isFalse();
        assertThat(second.incident().getId()).isEqualTo(first.incident().getId());

        Incident stored = incidentRepository.findById(first.incident().getId()).orElseThrow();
        assertThat(stored.getPriority()).isEqualTo(IncidentPriority.CRITICAL);
        assertThat(stored.getLastSignalTime()).isAfterOrEqualTo(stored.getFirstSignalTime());
        assertThat(signalRepository.countByIncidentId(stored.getId())).isEqualTo(2);
        assertThat(events(stored.getId(), IncidentEventType.PRIORITY_CHANGED)).isEqualTo(1);
    }

    @Test
    @DisplayName("A lower-priority signal never lowers an incident's priority")
    void shouldNeverLowerPriority() {
        // Given
        Beacon lab = beacon("safe:uuid:210:1");
        device("ESP32-002", DeviceType.PANIC_BUTTON, lab);
        DispatchResult panic = orchestrator.handlePanicButton("ESP32-002", null);

        // When
        sos(lab, "student-9");

        // Then
        Incident stored = incidentRepository.findById(panic.incident().getId()).orElseThrow();
        assertThat(stored.getPriority()).isEqualTo(IncidentPriority.CRITICAL);
        assertThat(events(stored.getId(), IncidentEventType.PRIORITY_CHANGED)).isZero();
    }

    @Test
    @DisplayName("Signals at unknown or inactive beacons are rejected without creating anything")
    void shouldRejectUnknownAndInactiveBeacons() {
        // Given
        Beacon retired = inactiveBeacon("safe:uuid:old:1");

        // When / Then
        assertThatThrownBy(() -> sos(Beacon.builder().hardwareId("safe:uuid:missing").build(), "student-1"))
            .isInstanceOf(UnknownOrInactiveBeaconException.class);
        assertThatThrownBy(() -> sos(retired, "student-1"))
            .isInstanceOf(UnknownOrInactiveBeaconException.class);
        assertThat(incidentRepository.count()).isZero();
        assertThat(signalRepository.count()).isZero();
    }

    @Test
    @DisplayName("Resolving an incident frees the beacon for a new incident")
    void shouldOpenNewIncidentAfterResolution() {
        // Given
        Beacon gym = beacon("safe:uuid:gym:1");
        DispatchResult first = sos(gym, "student-1");
        alertLifecycleManager.resolveIncident(
            first.incident().getId(), SignalActor.admin("admin-1"), "False alarm", ResolutionType.ESCALATED_TO_ADMIN);

        // When
        DispatchResult second = sos(gym, "student-2");

        // Then
        assertThat(second.wasCreated()).isTrue();
        assertThat(second.incident().getId()).isNotEqualTo(first.incident().getId());
        assertThat(incidentRepository.findById(first.incident().getId()).orElseThrow().getOpenBeaconId()).isNull();
        assertThat(incidentRepository.countByBeaconIdAndStatusIn(gym.getId(), IncidentStatus.OPEN)).isEqualTo(1);
    }

    @Test
    @DisplayName("A new incident alerts the nearest guard and pushes the alert after commit")
    void shouldAlertNearestGuardOnCreation() {
        // Given
        Beacon hall = beacon("safe:uuid:hall:1");
        GuardProfile guard = guardAt("Officer Kim", hall);

        // When
        DispatchResult result = sos(hall, "student-1");

        // Then
        assertThat(result.alerts()).hasSize(1);
        assertThat(result.alerts().get(0).getGuardId()).isEqualTo(guard.getId());
        assertThat(result.alerts().get(0).getPriorityRank()).isEqualTo(1);
        assertThat(result.alerts().get(0).getHopPriority()).isZero();
        assertThat(result.noCandidates()).isFalse();
        assertThat(result.incident().getTotalAlertsSent()).isEqualTo(1);

        ArgumentCaptor<GuardNotification> captor = ArgumentCaptor.forClass(GuardNotification.class);
        verify(guardNotifier, timeout(2000)).notify(captor.capture());
        GuardNotification pushed = captor.getValue();
        assertThat(pushed.guardId()).isEqualTo(guard.getId());
        assertThat(pushed.kind()).isEqualTo(NotificationKind.INCIDENT_ALERT);
        assertThat(pushed.incidentId()).isEqualTo(result.incident().getId());
        assertThat(pushed.payload()).containsKeys("responseDeadline", "priorityRank", "beaconId");
    }

    @Test
    @DisplayName("An incident with nobody in reach is flagged and audited as exhausted")
    void shouldFlagIncidentWithNoCandidates() {
        // Given
        Beacon roof = beacon("safe:uuid:roof:1");

        // When
        DispatchResult result = sos(roof, "student-1");

        // Then
        assertThat(result.wasCreated()).isTrue();
        assertThat(result.noCandidates()).isTrue();
        assertThat(events(result.incident().getId(), IncidentEventType.ALL_GUARDS_EXHAUSTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed push keeps the alert pending and is audited as ALERT_FAILED")
    void shouldAuditFailedDeliveryAndKeepAlertSent() {
        // Given
        Beacon hall = beacon("safe:uuid:hall:1");
        GuardProfile guard = guardAt("Officer Kim", hall);
        doThrow(new NotificationDeliveryException(guard.getId(), new IOException("push gateway unreachable")))
            .when(guardNotifier).notify(any(GuardNotification.class));

        // When
        DispatchResult result = sos(hall, "student-1");
        Long incidentId = result.incident().getId();

        // Then
        await().atMost(Duration.ofSeconds(5))
            .untilAsserted(() -> assertThat(events(incidentId, IncidentEventType.ALERT_FAILED)).isEqualTo(1));
        assertThat(alertFor(incidentId, guard.getId()).getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(pendingAlerts(incidentId)).isEqualTo(1);
        assertThat(events(incidentId, IncidentEventType.ALERT_DELIVERED)).isZero();
    }

    @Test
    @DisplayName("A signal with a large free-form payload is stored, not mistaken for a creation race")
    void shouldStoreLargeSignalDetails() {
        // Given
        Beacon library = beacon("safe:uuid:403:403");
        String note = "x".repeat(5000);

        // When
        DispatchResult result = orchestrator.handleSignal(new SignalCommand(library.getHardwareId(),
            SignalType.STUDENT_SOS, SignalActor.student("student-1"), null, null, Map.of("note", note)));

        // Then
        assertThat(result.wasCreated()).isTrue();
        assertThat(incidentRepository.count()).isEqualTo(1);
        assertThat(signalRepository.findAll())
            .singleElement()
            .satisfies(signal -> assertThat(signal.getDetails()).containsEntry("note", note));
    }
}
