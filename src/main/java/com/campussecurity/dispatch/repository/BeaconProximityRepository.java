package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.BeaconProximity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for beacon adjacency edges.
 *
 * The bulk shift queries keep sibling priorities dense; callers hold the from-beacon row lock.
 */
@Repository
public interface BeaconProximityRepository extends JpaRepository<BeaconProximity, Long> {

    List<BeaconProximity> findByFromBeaconIdOrderByPriorityAscIdAsc(Long fromBeaconId);

    /**
     * Whole graph, grouped by origin and ordered by priority. Used to build the search snapshot.
     */
    List<BeaconProximity> findAllByOrderByFromBeaconIdAscPriorityAscIdAsc();

    Optional<BeaconProximity> findByFromBeaconIdAndToBeaconId(Long fromBeaconId, Long toBeaconId);

    long countByFromBeaconId(Long fromBeaconId);

    /**
     * Opens a gap at {@code priority} by shifting it and everything after it down one place.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE BeaconProximity p SET p.priority = p.priority + 1
        WHERE p.fromBeaconId = :fromBeaconId AND p.priority >= :priority
        """)
    int shiftDownFrom(@Param("fromBeaconId") Long fromBeaconId, @Param("priority") int priority);

    /**
     * Closes the gap left at {@code priority}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE BeaconProximity p SET p.priority = p.priority - 1
        WHERE p.fromBeaconId = :fromBeaconId AND p.priority > :priority
        """)
    int shiftUpAfter(@Param("fromBeaconId") Long fromBeaconId, @Param("priority") int priority);

    /**
     * Shifts the closed range [low, high] by {@code delta} (+1 or -1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE BeaconProximity p SET p.priority = p.priority + :delta
        WHERE p.fromBeaconId = :fromBeaconId AND p.priority >= :low AND p.priority <= :high
        """)
    int shiftRange(
        @Param("fromBeaconId") Long fromBeaconId,
        @Param("low") int low,
        @Param("high") int high,
        @Param("delta") int delta
    );
}
