package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.AuditEvent;
import com.campussecurity.dispatch.dto.IncidentResolution;
import com.campussecurity.dispatch.dto.SignalCommand;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.IncidentPriority;
import com.campussecurity.dispatch.entity.IncidentSignal;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.exception.UnknownOrInactiveBeaconException;
import com.campussecurity.dispatch.repository.BeaconRepository;
import com.campussecurity.dispatch.repository.IncidentRepository;
import com.campussecurity.dispatch.repository.IncidentSignalRepository;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative incident state and owner of the dedup contract: at most one open incident
 * per beacon.
 *
 * Flow of {@link #resolveOrCreateIncident(SignalCommand)}:
 * 1. Lock the beacon row ({@code SELECT ... FOR UPDATE}); unknown or inactive beacons fail
 * 2. Look up the beacon's open incident and lock its row
 * 3. Found: attach the signal, bump {@code lastSignalTime}, raise priority if the signal
 *    implies a higher one
 * 4. Not found: open a new CREATED incident with the signal as its first
 * 5. Audit the creation or merge in the same transaction
 *
 * Two creators can only race past step 1 if the lock is bypassed (a second application node
 * reading through a replica, a manual insert). The {@code open_beacon_id} unique constraint
 * then rejects the loser, whose whole transaction is rolled back and replayed once; on replay
 * it finds the winner's incident and merges into it.
 */
@Service
@Slf4j
public class IncidentStore {

    private final BeaconRepository beaconRepository;
    private final IncidentRepository incidentRepository;
    private final IncidentSignalRepository signalRepository;
    private final AuditSink auditSink;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IncidentStore(BeaconRepository beaconRepository,
                         IncidentRepository incidentRepository,
                         IncidentSignalRepository signalRepository,
                         AuditSink auditSink,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.beaconRepository = beaconRepository;
        this.incidentRepository = incidentRepository;
        this.signalRepository = signalRepository;
        this.auditSink = auditSink;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public IncidentResolution resolveOrCreateIncident(SignalCommand command) {
        try {
            return transactionTemplate.execute(status -> resolveOrCreateLocked(command));
        } catch (DataIntegrityViolationException e) {
            if (!isOpenBeaconConflict(e)) {
                throw e;
            }
            log.warn("Concurrent incident creation at beacon {}, retrying as merge: {}",
                command.beaconHardwareId(), e.getMostSpecificCause().getMessage());
            return transactionTemplate.execute(status -> resolveOrCreateLocked(command));
        }
    }

    /**
     * Hibernate reports the constraint name where the driver exposes it (PostgreSQL); other
     * drivers only name the backing index in the message.
     */
    static boolean isOpenBeaconConflict(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException
                && mentionsOpenBeaconConstraint(((ConstraintViolationException) cause).getConstraintName())) {
                return true;
            }
            if (mentionsOpenBeaconConstraint(cause.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsOpenBeaconConstraint(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(Incident.OPEN_BEACON_CONSTRAINT);
    }

    private IncidentResolution resolveOrCreateLocked(SignalCommand command) {
        Beacon beacon = beaconRepository.findByHardwareIdForUpdate(command.beaconHardwareId())
            .filter(Beacon::isOperational)
            .orElseThrow(() -> new UnknownOrInactiveBeaconException(command.beaconHardwareId()));

        Instant now = clock.instant();
        Optional<Incident> open = findOpenIncidentLocked(beacon.getId());

        if (open.isPresent()) {
            return merge(open.get(), command, now);
        }
        return create(beacon, command, now);
    }

    private Optional<Incident> findOpenIncidentLocked(Long beaconId) {
        List<Long> ids = incidentRepository.findOpenIncidentIds(beaconId, IncidentStatus.OPEN);
        if (ids.size() > 1) {
            log.error("Beacon {} has {} open incidents {}; merging into the newest", beaconId, ids.size(), ids);
        }
        for (Long id : ids) {
            Optional<Incident> locked = incidentRepository.findByIdForUpdate(id).filter(Incident::isOpen);
            if (locked.isPresent()) {
                return locked;
            }
        }
        return Optional.empty();
    }

    private IncidentResolution merge(Incident incident, SignalCommand command, Instant now) {
        IncidentSignal signal = storeSignal(incident.getId(), command);

        incident.setLastSignalTime(now);
        IncidentPriority previous = incident.getPriority();
        IncidentPriority escalated = previous.max(command.signalType().impliedPriority());
        if (escalated != previous) {
            incident.setPriority(escalated);
            auditSink.record(AuditEvent.builder()
                .incidentId(incident.getId())
                .type(IncidentEventType.PRIORITY_CHANGED)
                .actorRole(command.actor().role())
                .actorId(command.actor().actorId())
                .previousPriority(previous)
                .newPriority(escalated)
                .details(Map.of("signalType", command.signalType().name()))
                .build());
            log.info("Incident {} priority raised {} -> {} by {}",
                incident.getId(), previous, escalated, command.signalType());
        }
        Incident saved = incidentRepository.save(incident);

        auditSink.record(AuditEvent.builder()
            .incidentId(saved.getId())
            .type(IncidentEventType.SIGNAL_MERGED)
            .actorRole(command.actor().role())
            .actorId(command.actor().actorId())
            .details(signalDetails(signal, command))
            .build());

        log.info("Signal merged into open incident: {} <- {}", saved.toLogString(), command.toLogString());
        return new IncidentResolution(saved, false, signal);
    }

    private IncidentResolution create(Beacon beacon, SignalCommand command, Instant now) {
        Incident incident = incidentRepository.saveAndFlush(
            Incident.open(beacon.getId(), command.signalType(), command.description(), now)
        );
        IncidentSignal signal = storeSignal(incident.getId(), command);

        Map<String, Object> details = signalDetails(signal, command);
        details.put("beacon", beacon.getHardwareId());
        details.put("location", beacon.getLocationName());
        auditSink.record(AuditEvent.builder()
            .incidentId(incident.getId())
            .type(IncidentEventType.INCIDENT_CREATED)
            .actorRole(command.actor().role())
            .actorId(command.actor().actorId())
            .newStatus(incident.getStatus())
            .newPriority(incident.getPriority())
            .details(details)
            .build());

        log.info("New incident opened: {} at {} from {}",
            incident.toLogString(), beacon.toLogString(), command.toLogString());
        return new IncidentResolution(incident, true, signal);
    }

    private IncidentSignal storeSignal(Long incidentId, SignalCommand command) {
        return signalRepository.save(IncidentSignal.builder()
            .incidentId(incidentId)
            .signalType(command.signalType())
            .actorRole(command.actor().role())
            .actorId(command.actor().actorId())
            .confidence(command.confidence())
            .details(command.details())
            .build());
    }

    private Map<String, Object> signalDetails(IncidentSignal signal, SignalCommand command) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("signalId", signal.getId());
        details.put("signalType", command.signalType().name());
        if (command.confidence() != null) {
            details.put("confidence", command.confidence());
        }
        return details;
    }
}
