package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.exception.GuardNotFoundException;
import com.campussecurity.dispatch.exception.UnknownOrInactiveBeaconException;
import com.campussecurity.dispatch.repository.BeaconRepository;
import com.campussecurity.dispatch.repository.GuardProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Guard location pings and availability toggles.
 *
 * The mobile app reports the nearest beacon every 10-15 seconds; the last report is the
 * guard's position for the dispatch search.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardService {

    private final GuardProfileRepository guardRepository;
    private final BeaconRepository beaconRepository;
    private final Clock clock;

    @Transactional
    public GuardProfile updateLocation(Long guardId, String beaconHardwareId) {
        GuardProfile guard = loadGuard(guardId);
        Beacon beacon = beaconRepository.findByHardwareIdAndActiveTrue(beaconHardwareId)
            .orElseThrow(() -> new UnknownOrInactiveBeaconException(beaconHardwareId));

        Instant now = clock.instant();
        Long previous = guard.getCurrentBeaconId();
        guard.setCurrentBeaconId(beacon.getId());
        guard.setLastBeaconUpdate(now);
        guard.setLastActiveAt(now);

        if (!beacon.getId().equals(previous)) {
            log.info("Guard {} moved to {}", guardId, beacon.toLogString());
        }
        return guardRepository.save(guard);
    }

    @Transactional
    public GuardProfile setAvailability(Long guardId, boolean available) {
        GuardProfile guard = loadGuard(guardId);
        guard.setAvailable(available);
        log.info("Guard {} availability set to {}", guardId, available);
        return guardRepository.save(guard);
    }

    @Transactional
    public GuardProfile setOnDuty(Long guardId, boolean onDuty) {
        GuardProfile guard = loadGuard(guardId);
        guard.setActive(onDuty);
        log.info("Guard {} {}", guardId, onDuty ? "went on duty" : "went off duty");
        return guardRepository.save(guard);
    }

    @Transactional(readOnly = true)
    public GuardProfile getGuard(Long guardId) {
        return loadGuard(guardId);
    }

    private GuardProfile loadGuard(Long guardId) {
        return guardRepository.findById(guardId).orElseThrow(() -> new GuardNotFoundException(guardId));
    }
}
