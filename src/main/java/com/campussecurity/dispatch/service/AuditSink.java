package com.campussecurity.dispatch.service;

import com.campussecurity.dispatch.dto.AuditEvent;

/**
 * Append-only incident audit log.
 *
 * Called inside the transaction that made the recorded change, so an event is persisted
 * exactly when its change is.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
