package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.Incident;
import com.campussecurity.dispatch.entity.IncidentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for incidents.
 */
@Repository
public interface IncidentRepository extends JpaRepository<Incident, Long> {

    /**
     * Ids of the open incidents at a beacon, newest first. Called under the beacon row lock,
     * so at most one id is expected. Returns ids rather than entities so the caller can then
     * lock the row with {@link #findByIdForUpdate(Long)} and read it fresh.
     */
    @Query("""
        SELECT i.id FROM Incident i
        WHERE i.beaconId = :beaconId AND i.status IN :statuses
        ORDER BY i.createdAt DESC, i.id DESC
        """)
    List<Long> findOpenIncidentIds(
        @Param("beaconId") Long beaconId,
        @Param("statuses") Collection<IncidentStatus> statuses
    );

    /**
     * Locks one incident row. This is the per-incident serialization point for alert and
     * assignment transitions.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Incident i WHERE i.id = :id")
    Optional<Incident> findByIdForUpdate(@Param("id") Long id);

    List<Incident> findByStatusInOrderByCreatedAtDesc(Collection<IncidentStatus> statuses);

    long countByBeaconIdAndStatusIn(Long beaconId, Collection<IncidentStatus> statuses);
}
