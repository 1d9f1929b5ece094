package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.GuardNotification;
import com.campussecurity.dispatch.dto.IncidentUpdate;
import com.campussecurity.dispatch.exception.NotificationDeliveryException;

/**
 * Push transport towards guards and dashboards.
 *
 * Only called after the dispatch transaction that produced the message has committed.
 * Retries and backoff are the transport's concern.
 */
public interface GuardNotifier {

    /**
     * @throws NotificationDeliveryException when the message could not be handed to the transport
     */
    void notify(GuardNotification notification);

    void broadcast(IncidentUpdate update);
}
