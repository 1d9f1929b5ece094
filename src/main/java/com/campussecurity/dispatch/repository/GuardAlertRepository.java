package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.GuardAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for guard alerts.
 */
@Repository
public interface GuardAlertRepository extends JpaRepository<GuardAlert, Long> {

    /**
     * Owning incident of an alert, read as a scalar so the alert itself is not loaded before
     * the incident row lock is taken.
     */
    @Query("SELECT a.incidentId FROM GuardAlert a WHERE a.id = :alertId")
    Optional<Long> findIncidentIdById(@Param("alertId") Long alertId);

    List<GuardAlert> findByIncidentIdOrderByPriorityRankAsc(Long incidentId);

    List<GuardAlert> findByIncidentIdAndStatusOrderByPriorityRankAsc(Long incidentId, AlertStatus status);

    List<GuardAlert> findByGuardIdOrderByAlertSentAtDesc(Long guardId);

    List<GuardAlert> findByGuardIdAndStatusOrderByAlertSentAtDesc(Long guardId, AlertStatus status);

    /**
     * Every guard ever alerted for an incident, whatever the alert's status.
     */
    @Query("SELECT a.guardId FROM GuardAlert a WHERE a.incidentId = :incidentId")
    List<Long> findAlertedGuardIds(@Param("incidentId") Long incidentId);

    @Query("SELECT COALESCE(MAX(a.priorityRank), 0) FROM GuardAlert a WHERE a.incidentId = :incidentId")
    int findMaxPriorityRank(@Param("incidentId") Long incidentId);

    /**
     * Pending alerts whose response deadline has passed, oldest deadline first.
     */
    @Query("""
        SELECT a FROM GuardAlert a
        WHERE a.status = com.campussecurity.dispatch.entity.AlertStatus.SENT
        AND a.responseDeadline IS NOT NULL
        AND a.responseDeadline < :now
        ORDER BY a.responseDeadline ASC
        """)
    List<GuardAlert> findOverdue(@Param("now") Instant now);

    long countByIncidentIdAndStatus(Long incidentId, AlertStatus status);
}
