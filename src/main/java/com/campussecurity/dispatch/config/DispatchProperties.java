package com.campussecurity.dispatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Dispatch tunables, bound from {@code dispatch.*} and handed to the engine's constructors.
 *
 * @param maxGuards                   guards alerted when an incident is opened
 * @param responseTimeout             how long a guard has to answer an alert
 * @param aiVisionConfidenceThreshold AI_VISION detections below this are dropped
 * @param aiAudioConfidenceThreshold  AI_AUDIO detections below this are dropped
 * @param alerts                      deadline sweeper settings
 * @param graph                       beacon graph cache settings
 * @param websocket                   STOMP endpoint settings
 */
@ConfigurationProperties(prefix = "dispatch")
public record DispatchProperties(
    @DefaultValue("3") int maxGuards,
    @DefaultValue("45s") Duration responseTimeout,
    @DefaultValue("0.75") double aiVisionConfidenceThreshold,
    @DefaultValue("0.80") double aiAudioConfidenceThreshold,
    @DefaultValue Alerts alerts,
    @DefaultValue Graph graph,
    @DefaultValue Websocket websocket
) {

    public DispatchProperties {
        if (maxGuards < 1) {
            throw new IllegalArgumentException("dispatch.max-guards must be >= 1");
        }
        if (responseTimeout == null || responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("dispatch.response-timeout must be positive");
        }
    }

    public record Alerts(
        @DefaultValue("true") boolean expirySweepEnabled,
        @DefaultValue("10000") long expirySweepIntervalMs
    ) {
    }

    public record Graph(@DefaultValue("60m") Duration cacheTtl) {
    }

    public record Websocket(
        @DefaultValue("/ws/dispatch") String endpoint,
        @DefaultValue("*") String allowedOrigins
    ) {
    }
}
