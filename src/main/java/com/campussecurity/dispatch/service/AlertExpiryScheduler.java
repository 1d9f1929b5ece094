package com.campussecurity.dispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives alert deadlines: no guard action is needed for an ignored alert to escalate.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatch.alerts", name = "expiry-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class AlertExpiryScheduler {

    private final AlertLifecycleManager alertLifecycleManager;

    @Scheduled(fixedDelayString = "${dispatch.alerts.expiry-sweep-interval-ms:10000}")
    public void sweep() {
        alertLifecycleManager.expireOverdueAlerts();
    }
}
