package com.campussecurity.dispatch.entity;

public enum DeviceType {
    PANIC_BUTTON(SignalType.PANIC_BUTTON),
    AI_VISION(SignalType.AI_VISION),
    AI_AUDIO(SignalType.AI_AUDIO);

    private final SignalType signalType;

    DeviceType(SignalType signalType) {
        this.signalType = signalType;
    }

    public SignalType signalType() {
        return signalType;
    }
}
