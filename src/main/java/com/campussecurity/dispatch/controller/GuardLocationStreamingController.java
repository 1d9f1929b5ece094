package com.campussecurity.dispatch.controller;

import com.campussecurity.dispatch.dto.LocationUpdateRequest;
import com.campussecurity.dispatch.entity.GuardProfile;
import com.campussecurity.dispatch.exception.DispatchException;
import com.campussecurity.dispatch.service.GuardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket controller for guard location pings.
 *
 * Message Flow:
 * 1. The guard app sends the strongest beacon in range to /app/guard/location
 * 2. The guard's current beacon is updated (the dispatch search position)
 * 3. An acknowledgement goes back on /user/queue/reply
 *
 * The guard id comes from the STOMP principal when the session is authenticated, otherwise
 * from the message body.
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/dispatch
 * - Send to: /app/guard/location  {"guardId": 7, "beaconId": "safe:uuid:403:403"}
 * - Subscribe to: /user/queue/alerts, /user/queue/reply
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GuardLocationStreamingController {

    static final String REPLY_QUEUE = "/queue/reply";

    private final GuardService guardService;
    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    @MessageMapping("/guard/location")
    public void handleLocationPing(@Payload LocationUpdateRequest ping, Principal principal) {
        Long guardId = resolveGuardId(ping, principal);
        if (guardId == null || ping.beaconId() == null || ping.beaconId().isBlank()) {
            log.warn("Rejected location ping without guard or beacon: {}", ping);
            return;
        }

        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("guardId", guardId);
        ack.put("beaconId", ping.beaconId());
        ack.put("timestamp", clock.instant().toString());

        try {
            GuardProfile guard = guardService.updateLocation(guardId, ping.beaconId());
            ack.put("status", "OK");
            ack.put("available", guard.isDispatchable());
        } catch (DispatchException e) {
            log.warn("Location ping from guard {} rejected: {}", guardId, e.getMessage());
            ack.put("status", "ERROR");
            ack.put("errorCode", e.getErrorCode());
            ack.put("message", e.getMessage());
        }

        messagingTemplate.convertAndSendToUser(String.valueOf(guardId), REPLY_QUEUE, ack);
    }

    private Long resolveGuardId(LocationUpdateRequest ping, Principal principal) {
        if (principal != null) {
            try {
                return Long.valueOf(principal.getName());
            } catch (NumberFormatException e) {
                log.debug("Principal {} is not a guard id, using message body", principal.getName());
            }
        }
        return ping.guardId();
    }
}
