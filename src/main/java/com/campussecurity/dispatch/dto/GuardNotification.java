package com.campussecurity.dispatch.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A push message for one guard, published inside a dispatch transaction and delivered only
 * after that transaction commits.
 *
 * @param guardId    addressee
 * @param incidentId incident the message is about
 * @param alertId    alert the message is about, if any
 * @param kind       message kind
 * @param payload    message body
 */
public record GuardNotification(
    Long guardId,
    Long incidentId,
    Long alertId,
    NotificationKind kind,
    Map<String, Object> payload
) {

    public GuardNotification {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
