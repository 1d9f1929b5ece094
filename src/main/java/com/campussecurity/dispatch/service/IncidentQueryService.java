package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.IncidentDetail;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentStatus;
import com.campussecurity.dispatch.exception.GuardNotFoundException;
import com.campussecurity.dispatch.exception.IncidentNotFoundException;
import com.campussecurity.dispatch.repository.GuardAlertRepository;
import com.campussecurity.dispatch.repository.GuardAssignmentRepository;
import com.campussecurity.dispatch.repository.GuardProfileRepository;
import com.campussecurity.dispatch.repository.IncidentEventRepository;
import com.campussecurity.dispatch.repository.IncidentRepository;
import com.campussecurity.dispatch.repository.IncidentSignalRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only views over incidents and alerts.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IncidentQueryService {

    private final IncidentRepository incidentRepository;
    private final IncidentSignalRepository signalRepository;
    private final GuardAlertRepository alertRepository;
    private final GuardAssignmentRepository assignmentRepository;
    private final IncidentEventRepository eventRepository;
    private final GuardProfileRepository guardRepository;

    public Incident getIncident(Long incidentId) {
        return incidentRepository.findById(incidentId)
            .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    public IncidentDetail getIncidentDetail(Long incidentId) {
        Incident incident = getIncident(incidentId);
        return new IncidentDetail(
            incident,
            signalRepository.findByIncidentIdOrderByCreatedAtAscIdAsc(incidentId),
            alertRepository.findByIncidentIdOrderByPriorityRankAsc(incidentId),
            assignmentRepository.findByIncidentIdOrderByIdAsc(incidentId),
            eventRepository.findByIncidentIdOrderByIdAsc(incidentId)
        );
    }

    public List<Incident> listOpenIncidents() {
        return incidentRepository.findByStatusInOrderByCreatedAtDesc(IncidentStatus.OPEN);
    }

    /**
     * A guard's alerts, newest first; pass a status to filter (e.g. SENT for the inbox).
     */
    public List<GuardAlert> listGuardAlerts(Long guardId, AlertStatus status) {
        if (!guardRepository.existsById(guardId)) {
            throw new GuardNotFoundException(guardId);
        }
        if (status == null) {
            return alertRepository.findByGuardIdOrderByAlertSentAtDesc(guardId);
        }
        return alertRepository.findByGuardIdAndStatusOrderByAlertSentAtDesc(guardId, status);
    }
}
