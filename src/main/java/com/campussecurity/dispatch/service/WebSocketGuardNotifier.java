package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.GuardNotification;
import com.campussecurity.dispatch.dto.IncidentUpdate;
import com.campussecurity.dispatch.exception.NotificationDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * STOMP implementation of {@link GuardNotifier}.
 *
 * - Guard messages go to {@code /user/{guardId}/queue/alerts}; the guard app authenticates
 *   its STOMP session with the guard profile id as principal name.
 * - Incident updates go to {@code /topic/incidents}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebSocketGuardNotifier implements GuardNotifier {

    static final String ALERT_QUEUE = "/queue/alerts";
    static final String INCIDENT_TOPIC = "/topic/incidents";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void notify(GuardNotification notification) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", notification.kind().name());
        message.put("incidentId", notification.incidentId());
        message.put("alertId", notification.alertId());
        message.putAll(notification.payload());

        try {
            messagingTemplate.convertAndSendToUser(
                String.valueOf(notification.guardId()),
                ALERT_QUEUE,
                message
            );
        } catch (MessagingException e) {
            throw new NotificationDeliveryException(notification.guardId(), e);
        }

        log.debug("Pushed {} to guard {} (incident {})",
            notification.kind(), notification.guardId(), notification.incidentId());
    }

    @Override
    public void broadcast(IncidentUpdate update) {
        messagingTemplate.convertAndSend(INCIDENT_TOPIC, update);
    }
}
