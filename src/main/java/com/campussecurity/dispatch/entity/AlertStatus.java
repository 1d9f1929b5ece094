package com.campussecurity.dispatch.entity;

/**
 * GuardAlert state machine: SENT -> {ACCEPTED | DECLINED | EXPIRED}. Every state but SENT is terminal.
 */
public enum AlertStatus {
    SENT,
    ACCEPTED,
    DECLINED,
    EXPIRED;

    public boolean isTerminal() {
        return this != SENT;
    }
}
