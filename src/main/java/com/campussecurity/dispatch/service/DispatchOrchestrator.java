package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.config.DispatchProperties;
import com.campussecurity.dispatch.dto.AlertResult;
import com.campussecurity.dispatch.dto.DispatchResult;
import com.campussecurity.dispatch.dto.IncidentResolution;
import com.campussecurity.dispatch.dto.SignalActor;
import com.campussecurity.dispatch.dto.SignalCommand;
import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.Beacon;
import com.campussecurity.dispatch.entity.DeviceType;
import com.campussecurity.dispatch.entity.GuardAlert;
import com.campussecurity.dispatch.entity.PhysicalDevice;
import com.campussecurity.dispatch.entity.SignalType;
import com.campussecurity.dispatch.exception.DeviceNotFoundException;
import com.campussecurity.dispatch.exception.InvalidActorException;
import com.campussecurity.dispatch.exception.UnknownOrInactiveBeaconException;
import com.campussecurity.dispatch.repository.BeaconRepository;
import com.campussecurity.dispatch.repository.PhysicalDeviceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for inbound signals and guard responses.
 *
 * Signal flow:
 * 1. Validate the actor against the signal type
 * 2. Resolve or create the beacon's open incident ({@link IncidentStore})
 * 3. Only for a new incident: alert the first wave of nearby guards ({@link AlertLifecycleManager})
 *
 * Steps 2 and 3 are separate transactions: the incident is visible (and mergeable) as soon as
 * it exists, and alerts are pushed once step 3 commits. Safe to call concurrently for the same
 * beacon from every inbound channel.
 */
@Service
@Slf4j
public class DispatchOrchestrator {

    private final IncidentStore incidentStore;
    private final AlertLifecycleManager alertLifecycleManager;
    private final IncidentQueryService incidentQueryService;
    private final PhysicalDeviceRepository deviceRepository;
    private final BeaconRepository beaconRepository;
    private final int maxGuards;
    private final double aiVisionThreshold;
    private final double aiAudioThreshold;

    public DispatchOrchestrator(IncidentStore incidentStore,
                                AlertLifecycleManager alertLifecycleManager,
                                IncidentQueryService incidentQueryService,
                                PhysicalDeviceRepository deviceRepository,
                                BeaconRepository beaconRepository,
                                DispatchProperties properties) {
        this.incidentStore = incidentStore;
        this.alertLifecycleManager = alertLifecycleManager;
        this.incidentQueryService = incidentQueryService;
        this.deviceRepository = deviceRepository;
        this.beaconRepository = beaconRepository;
        this.maxGuards = properties.maxGuards();
        this.aiVisionThreshold = properties.aiVisionConfidenceThreshold();
        this.aiAudioThreshold = properties.aiAudioConfidenceThreshold();
    }

    public DispatchResult handleSignal(SignalCommand command) {
        validateActor(command.signalType(), command.actor().role());
        log.debug("Handling {}", command.toLogString());

        IncidentResolution resolution = incidentStore.resolveOrCreateIncident(command);
        if (!resolution.wasCreated()) {
            return DispatchResult.merged(resolution);
        }

        Long incidentId = resolution.incident().getId();
        List<GuardAlert> alerts = alertLifecycleManager.dispatchInitialAlerts(incidentId, maxGuards);
        if (alerts.isEmpty()) {
            log.warn("Incident {} opened with no guard to alert; operator follow-up required", incidentId);
        }

        IncidentResolution refreshed = new IncidentResolution(
            incidentQueryService.getIncident(incidentId), true, resolution.signal());
        return DispatchResult.created(refreshed, alerts);
    }

    /**
     * Panic button press. The device's beacon is the incident location.
     */
    public DispatchResult handlePanicButton(String deviceId, Map<String, Object> details) {
        PhysicalDevice device = activeDevice(deviceId);
        if (device.getDeviceType() != DeviceType.PANIC_BUTTON) {
            throw new InvalidActorException("Device " + deviceId + " is not a panic button");
        }

        String description = "Panic button pressed" + (device.getName() == null ? "" : ": " + device.getName());
        return handleSignal(new SignalCommand(
            beaconOf(device).getHardwareId(),
            SignalType.PANIC_BUTTON,
            SignalActor.device(deviceId),
            description,
            null,
            details
        ));
    }

    /**
     * AI vision/audio detection. Detections below the device type's confidence threshold are
     * dropped without touching any incident.
     */
    public DispatchResult handleAiDetection(String deviceId, double confidence, Map<String, Object> details) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        PhysicalDevice device = activeDevice(deviceId);
        SignalType signalType = device.getDeviceType().signalType();
        if (!signalType.isAiDetection()) {
            throw new InvalidActorException("Device " + deviceId + " is not an AI detector");
        }

        double threshold = signalType == SignalType.AI_VISION ? aiVisionThreshold : aiAudioThreshold;
        if (confidence < threshold) {
            log.info("AI detection from {} suppressed: confidence {} below threshold {}",
                deviceId, confidence, threshold);
            return DispatchResult.suppressedSignal();
        }

        String description = (signalType == SignalType.AI_VISION ? "AI vision" : "AI audio")
            + " detection (confidence " + confidence + ")";
        return handleSignal(new SignalCommand(
            beaconOf(device).getHardwareId(),
            signalType,
            SignalActor.device(deviceId),
            description,
            confidence,
            details
        ));
    }

    public AlertResult acceptAlert(Long alertId, Long respondingGuardId) {
        return alertLifecycleManager.accept(alertId, respondingGuardId);
    }

    public AlertResult declineAlert(Long alertId, Long respondingGuardId) {
        return alertLifecycleManager.decline(alertId, respondingGuardId);
    }

    static void validateActor(SignalType signalType, ActorRole role) {
        boolean allowed = switch (signalType) {
            case STUDENT_SOS -> switch (role) {
                case STUDENT, GUARD, ADMIN -> true;
                case DEVICE, SYSTEM -> false;
            };
            case PANIC_BUTTON -> switch (role) {
                case DEVICE -> true;
                case STUDENT, GUARD, ADMIN, SYSTEM -> false;
            };
            case AI_VISION, AI_AUDIO -> switch (role) {
                case DEVICE, SYSTEM -> true;
                case STUDENT, GUARD, ADMIN -> false;
            };
        };
        if (!allowed) {
            throw new InvalidActorException(signalType, role);
        }
    }

    private PhysicalDevice activeDevice(String deviceId) {
        return deviceRepository.findByDeviceIdAndActiveTrue(deviceId)
            .orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    private Beacon beaconOf(PhysicalDevice device) {
        return beaconRepository.findById(device.getBeaconId())
            .orElseThrow(() -> new UnknownOrInactiveBeaconException(String.valueOf(device.getBeaconId())));
    }
}
