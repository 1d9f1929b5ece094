package com.campussecurity.dispatch.entity;

/**
 * Kind of observation contributing to an incident, with the priority it implies.
 */
public enum SignalType {
    STUDENT_SOS(IncidentPriority.MEDIUM),
    AI_VISION(IncidentPriority.CRITICAL),
    AI_AUDIO(IncidentPriority.HIGH),
    PANIC_BUTTON(IncidentPriority.CRITICAL);

    private final IncidentPriority impliedPriority;

    SignalType(IncidentPriority impliedPriority) {
        this.impliedPriority = impliedPriority;
    }

    public IncidentPriority impliedPriority() {
        return impliedPriority;
    }

    public boolean isAiDetection() {
        return this == AI_VISION || this == AI_AUDIO;
    }
}
