package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.AuditEvent;
import com.campussecurity.dispatch.entity.IncidentEvent;
import com.campussecurity.dispatch.repository.IncidentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaAuditSink implements AuditSink {

    private final IncidentEventRepository eventRepository;

    @Override
    public void record(AuditEvent event) {
        IncidentEvent saved = eventRepository.save(IncidentEvent.builder()
            .incidentId(event.incidentId())
            .eventType(event.type())
            .actorRole(event.actorRole())
            .actorId(event.actorId())
            .targetGuardId(event.targetGuardId())
            .alertId(event.alertId())
            .previousStatus(event.previousStatus())
            .newStatus(event.newStatus())
            .previousPriority(event.previousPriority())
            .newPriority(event.newPriority())
            .details(event.details() == null ? Map.of() : event.details())
            .build());

        log.debug("Audit: incident={} type={} event={}", event.incidentId(), event.type(), saved.getId());
    }
}
