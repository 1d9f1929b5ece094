package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.GuardProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for guard profiles.
 */
@Repository
public interface GuardProfileRepository extends JpaRepository<GuardProfile, Long> {

    /**
     * Guards standing at a beacon who could take an incident: on duty, available, with an
     * enabled account. Ordered by id so a search over a fixed snapshot is deterministic.
     */
    @Query("""
        SELECT g FROM GuardProfile g
        WHERE g.currentBeaconId = :beaconId
        AND g.active = true
        AND g.available = true
        AND g.accountActive = true
        ORDER BY g.id ASC
        """)
    List<GuardProfile> findEligibleAtBeacon(@Param("beaconId") Long beaconId);
}
