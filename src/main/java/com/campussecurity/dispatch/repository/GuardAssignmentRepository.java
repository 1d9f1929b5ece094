package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.GuardAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface GuardAssignmentRepository extends JpaRepository<GuardAssignment, Long> {

    Optional<GuardAssignment> findByIncidentIdAndActiveTrue(Long incidentId);

    Optional<GuardAssignment> findByGuardIdAndActiveTrue(Long guardId);

    Optional<GuardAssignment> findFirstByIncidentIdAndGuardIdOrderByIdDesc(Long incidentId, Long guardId);

    boolean existsByIncidentIdAndActiveTrue(Long incidentId);

    List<GuardAssignment> findByIncidentIdOrderByIdAsc(Long incidentId);

    long countByIncidentIdAndActiveTrue(Long incidentId);

    /**
     * Guards currently committed to some incident; excluded from candidate search.
     */
    @Query("SELECT a.guardId FROM GuardAssignment a WHERE a.active = true")
    Set<Long> findCommittedGuardIds();
}
