package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.AuditEvent;
import com.campussecurity.dispatch.dto.IncidentResolution;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.dto.SignalCommand;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentSignal;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.entity.SignalType;
import com.campussecurity.dispatch.repository.BeaconRepository;
import com.campussecurity.dispatch.repository.IncidentRepository;
import com.campussecurity.dispatch.repository.IncidentSignalRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IncidentStore Unit Tests")
class IncidentStoreTest {

    private static final String BEACON_HW = "safe:uuid:403:403";
    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    @Mock
    private BeaconRepository beaconRepository;

    @Mock
    private IncidentRepository incidentRepository;

    @Mock
    private IncidentSignalRepository signalRepository;

    @Mock
    private AuditSink auditSink;

    @Mock
    private PlatformTransactionManager transactionManager;

    private IncidentStore incidentStore;

    private final SignalCommand command =
        SignalCommand.of(BEACON_HW, SignalType.STUDENT_SOS, SignalActor.student("s-1"));

    @BeforeEach
    void setUp() {
        incidentStore = new IncidentStore(beaconRepository, incidentRepository, signalRepository, auditSink,
            transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenBeaconAndTransaction() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        Beacon beacon = Beacon.builder().id(1L).hardwareId(BEACON_HW).locationName("Library 3F").active(true).build();
        when(beaconRepository.findByHardwareIdForUpdate(BEACON_HW)).thenReturn(Optional.of(beacon));
    }

    private static DataIntegrityViolationException violation(String message, String constraintName) {
        return new DataIntegrityViolationException("could not execute statement",
            new ConstraintViolationException(message, new SQLException(message), constraintName));
    }

    @Test
    @DisplayName("Should replay as a merge when a concurrent creator wins the open-beacon constraint")
    void shouldRetryAsMergeOnOpenBeaconConflict() {
        // Given
        givenBeaconAndTransaction();
        Incident winner = Incident.open(1L, SignalType.STUDENT_SOS, "", NOW);
        winner.setId(10L);
        when(incidentRepository.findOpenIncidentIds(1L, IncidentStatus.OPEN))
            .thenReturn(List.of())
            .thenReturn(List.of(10L));
        when(incidentRepository.saveAndFlush(any(Incident.class)))
            .thenThrow(violation("duplicate key value violates unique constraint", "uk_incident_open_beacon"));
        when(incidentRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(winner));
        when(incidentRepository.save(winner)).thenReturn(winner);
        when(signalRepository.save(any(IncidentSignal.class)))
            .thenReturn(IncidentSignal.builder().id(55L).incidentId(10L).signalType(SignalType.STUDENT_SOS).build());

        // When
        IncidentResolution resolution = incidentStore.resolveOrCreateIncident(command);

        // Then
        assertThat(resolution.wasCreated()).isFalse();
        assertThat(resolution.incident().getId()).isEqualTo(10L);
        assertThat(resolution.incident().getLastSignalTime()).isEqualTo(NOW);
        verify(incidentRepository, times(1)).saveAndFlush(any(Incident.class));
        verify(transactionManager).rollback(any());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink, atLeastOnce()).record(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(AuditEvent::type)
            .containsExactly(IncidentEventType.SIGNAL_MERGED);
    }

    @Test
    @DisplayName("Should rethrow integrity violations unrelated to the open-beacon constraint without retrying")
    void shouldNotRetryOtherIntegrityViolations() {
        // Given
        givenBeaconAndTransaction();
        DataIntegrityViolationException tooLong = new DataIntegrityViolationException(
            "could not execute statement", new SQLException("Value too long for column \"details\""));
        when(incidentRepository.findOpenIncidentIds(1L, IncidentStatus.OPEN)).thenReturn(List.of());
        when(incidentRepository.saveAndFlush(any(Incident.class))).thenThrow(tooLong);

        // When / Then
        assertThatThrownBy(() -> incidentStore.resolveOrCreateIncident(command)).isSameAs(tooLong);
        verify(beaconRepository, times(1)).findByHardwareIdForUpdate(BEACON_HW);
        verify(incidentRepository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("Should recognise the open-beacon constraint by name or by the backing index in the message")
    void shouldRecogniseOpenBeaconConflict() {
        assertThat(IncidentStore.isOpenBeaconConflict(violation("duplicate key", "uk_incident_open_beacon")))
            .isTrue();
        assertThat(IncidentStore.isOpenBeaconConflict(new DataIntegrityViolationException("could not execute statement",
            new SQLException("Unique index or primary key violation: \"PUBLIC.UK_INCIDENT_OPEN_BEACON_INDEX_8 "
                + "ON PUBLIC.INCIDENTS(OPEN_BEACON_ID NULLS FIRST)\""))))
            .isTrue();
        assertThat(IncidentStore.isOpenBeaconConflict(violation("duplicate key", "uk_alert_incident_guard")))
            .isFalse();
    }
}
