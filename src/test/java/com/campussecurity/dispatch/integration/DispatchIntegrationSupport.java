package com.campussecurity.dispatch.integration;

import com.campussecurity.dispatch.dto.DispatchResult;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.dto.SignalCommand;
import com.campussecurity.dispatch.entity.AlertStatus;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.BeaconProximity;
import com.campussecurity.dispatch.entity.DeviceType;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.entity.PhysicalDevice;
import com.campussecurity.dispatch.entity.SignalType;
import com.campussecurity.dispatch.repository.BeaconProximityRepository;
import com.campussecurity.dispatch.repository.BeaconRepository;
import com.campussecurity.dispatch.repository.GuardAlertRepository;
import com.campussecurity.dispatch.repository.GuardAssignmentRepository;
import com.campussecurity.dispatch.repository.GuardProfileRepository;
import com.campussecurity.dispatch.repository.IncidentEventRepository;
import com.campussecurity.dispatch.repository.IncidentRepository;
import com.campussecurity.dispatch.repository.IncidentSignalRepository;
import com.campussecurity.dispatch.repository.PhysicalDeviceRepository;
import com.campussecurity.dispatch.service.AlertLifecycleManager;
import com.campussecurity.dispatch.service.BeaconGraphService;
import com.campussecurity.dispatch.service.DispatchOrchestrator;
import com.campussecurity.dispatch.service.GuardNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.util.List;

/**
 * Shared Spring context for the integration tests: H2 in PostgreSQL mode, a transaction-aware
 * in-memory cache, expiry sweep disabled, and a mocked {@link GuardNotifier} so pushes can be
 * verified.
 *
 * Every test starts from empty tables and a cold graph cache.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TransactionalCacheTestConfig.class)
abstract class DispatchIntegrationSupport {

    @MockBean
    protected GuardNotifier guardNotifier;

    @Autowired
    protected DispatchOrchestrator orchestrator;

    @Autowired
    protected AlertLifecycleManager alertLifecycleManager;

    @Autowired
    protected BeaconGraphService beaconGraphService;

    @Autowired
    protected BeaconRepository beaconRepository;

    @Autowired
    protected BeaconProximityRepository proximityRepository;

    @Autowired
    protected GuardProfileRepository guardRepository;

    @Autowired
    protected PhysicalDeviceRepository deviceRepository;

    @Autowired
    protected IncidentRepository incidentRepository;

    @Autowired
    protected IncidentSignalRepository signalRepository;

    @Autowired
    protected GuardAlertRepository alertRepository;

    @Autowired
    protected GuardAssignmentRepository assignmentRepository;

    @Autowired
    protected IncidentEventRepository eventRepository;

    @BeforeEach
    void resetState() {
        eventRepository.deleteAllInBatch();
        alertRepository.deleteAllInBatch();
        assignmentRepository.deleteAllInBatch();
        signalRepository.deleteAllInBatch();
        incidentRepository.deleteAllInBatch();
        deviceRepository.deleteAllInBatch();
        guardRepository.deleteAllInBatch();
        proximityRepository.deleteAllInBatch();
        beaconRepository.deleteAllInBatch();
        beaconGraphService.evict();
    }

    protected Beacon beacon(String hardwareId) {
        return beaconRepository.save(Beacon.builder()
            .hardwareId(hardwareId)
            .locationName("Location " + hardwareId)
            .building("Library")
            .floor(3)
            .active(true)
            .build());
    }

    protected Beacon inactiveBeacon(String hardwareId) {
        Beacon beacon = beacon(hardwareId);
        beacon.setActive(false);
        return beaconRepository.save(beacon);
    }

    protected BeaconProximity edge(Beacon from, Beacon to, int priority) {
        BeaconProximity saved = proximityRepository.save(BeaconProximity.builder()
            .fromBeaconId(from.getId())
            .toBeaconId(to.getId())
            .priority(priority)
            .build());
        beaconGraphService.evict();
        return saved;
    }

    protected GuardProfile guardAt(String name, Beacon beacon) {
        return guardRepository.save(GuardProfile.builder()
            .displayName(name)
            .currentBeaconId(beacon.getId())
            .build());
    }

    protected PhysicalDevice device(String deviceId, DeviceType type, Beacon beacon) {
        return deviceRepository.save(PhysicalDevice.builder()
            .deviceId(deviceId)
            .deviceType(type)
            .beaconId(beacon.getId())
            .name(deviceId)
            .build());
    }

    protected DispatchResult sos(Beacon beacon, String studentId) {
        return orchestrator.handleSignal(
            SignalCommand.of(beacon.getHardwareId(), SignalType.STUDENT_SOS, SignalActor.student(studentId)));
    }

    protected List<GuardAlert> alertsOf(Long incidentId) {
        return alertRepository.findByIncidentIdOrderByPriorityRankAsc(incidentId);
    }

    protected GuardAlert alertFor(Long incidentId, Long guardId) {
        return alertsOf(incidentId).stream()
            .filter(alert -> alert.getGuardId().equals(guardId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No alert for guard " + guardId + " on incident " + incidentId));
    }

    protected long pendingAlerts(Long incidentId) {
        return alertRepository.countByIncidentIdAndStatus(incidentId, AlertStatus.SENT);
    }

    protected long events(Long incidentId, IncidentEventType type) {
        return eventRepository.countByIncidentIdAndEventType(incidentId, type);
    }
}
