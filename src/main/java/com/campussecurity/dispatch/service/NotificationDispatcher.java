package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.AuditEvent;
import com.campussecurity.dispatch.dto.GuardNotification;
import com.campussecurity.dispatch.dto.IncidentUpdate;
import com.campussecurity.dispatch.dto.NotificationKind;
import com.campussecurity.dispatch.entity.ActorRole;
import com.campussecurity.dispatch.entity.IncidentEventType;
import com.campussecurity.dispatch.exception.NotificationDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Map;

/**
 * Delivers push messages once the dispatch transaction that produced them has committed.
 *
 * Messages are published as application events inside the transaction. If it rolls back they
 * are dropped; if it commits they are handed to the {@link GuardNotifier} on the async
 * executor, so no row lock is ever held across a network call.
 *
 * A failed delivery is logged and audited as ALERT_FAILED. The alert row is already committed
 * and stays authoritative; the guard app picks pending alerts up on its next poll.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final GuardNotifier notifier;
    private final AuditSink auditSink;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onGuardNotification(GuardNotification notification) {
        try {
            notifier.notify(notification);
            if (notification.kind() == NotificationKind.INCIDENT_ALERT) {
                auditSink.record(delivery(notification, IncidentEventType.ALERT_DELIVERED, Map.of()));
            }
        } catch (NotificationDeliveryException e) {
            log.warn("Notification delivery failed: guard={}, incident={}, kind={}: {}",
                notification.guardId(), notification.incidentId(), notification.kind(), e.getMessage());
            auditSink.record(delivery(notification, IncidentEventType.ALERT_FAILED,
                Map.of("kind", notification.kind().name(), "error", String.valueOf(e.getCause()))));
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIncidentUpdate(IncidentUpdate update) {
        notifier.broadcast(update);
    }

    private AuditEvent delivery(GuardNotification notification, IncidentEventType type, Map<String, Object> details) {
        return AuditEvent.builder()
            .incidentId(notification.incidentId())
            .type(type)
            .actorRole(ActorRole.SYSTEM)
            .targetGuardId(notification.guardId())
            .alertId(notification.alertId())
            .details(details)
            .build();
    }
}
