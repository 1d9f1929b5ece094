package com.campussecurity.dispatch.dto;

import com.campussecurity.dispatch.entity.SignalType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An inbound observation, as handed to the incident store.
 *
 * @param beaconHardwareId hardware id of the beacon where the signal was raised
 * @param signalType       kind of observation
 * @param actor            who or what raised it
 * @param description      optional free text, used only when a new incident is opened
 * @param confidence       detector confidence for AI signals, null otherwise
 * @param details          free-form signal payload
 */
public record SignalCommand(
    String beaconHardwareId,
    SignalType signalType,
    SignalActor actor,
    String description,
    Double confidence,
    Map<String, Object> details
) {

    public SignalCommand {
        Objects.requireNonNull(beaconHardwareId, "beaconHardwareId");
        Objects.requireNonNull(signalType, "signalType");
        Objects.requireNonNull(actor, "actor");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SignalCommand of(String beaconHardwareId, SignalType signalType, SignalActor actor) {
        return new SignalCommand(beaconHardwareId, signalType, actor, null, null, Map.of());
    }

    public String toLogString() {
        return String.format("Signal[beacon=%s, type=%s, actor=%s]",
            beaconHardwareId, signalType, actor.toLogString());
    }
}
