package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.Beacon;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for beacons.
 *
 * The {@code ForUpdate} finders issue {@code SELECT ... FOR UPDATE} and are the per-beacon
 * serialization point for incident dedup and proximity edits. They must run inside a
 * transaction; the row lock is held until commit.
 */
@Repository
public interface BeaconRepository extends JpaRepository<Beacon, Long> {

    Optional<Beacon> findByHardwareId(String hardwareId);

    Optional<Beacon> findByHardwareIdAndActiveTrue(String hardwareId);

    List<Beacon> findByActiveTrueOrderByBuildingAscFloorAscLocationNameAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Beacon b WHERE b.hardwareId = :hardwareId")
    Optional<Beacon> findByHardwareIdForUpdate(@Param("hardwareId") String hardwareId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Beacon b WHERE b.id = :id")
    Optional<Beacon> findByIdForUpdate(@Param("id") Long id);
}
