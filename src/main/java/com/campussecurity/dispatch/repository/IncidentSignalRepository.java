package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.IncidentSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentSignalRepository extends JpaRepository<IncidentSignal, Long> {

    List<IncidentSignal> findByIncidentIdOrderByCreatedAtAscIdAsc(Long incidentId);

    long countByIncidentId(Long incidentId);
}
