package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.IncidentEvent;
import com.campussecurity.dispatch.entity.IncidentEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentEventRepository extends JpaRepository<IncidentEvent, Long> {

    List<IncidentEvent> findByIncidentIdOrderByIdAsc(Long incidentId);

    List<IncidentEvent> findByIncidentIdAndEventTypeOrderByIdAsc(Long incidentId, IncidentEventType eventType);

    long countByIncidentIdAndEventType(Long incidentId, IncidentEventType eventType);
}
