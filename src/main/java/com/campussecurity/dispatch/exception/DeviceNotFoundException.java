package com.campussecurity.dispatch.exception;

public class DeviceNotFoundException extends DispatchException {

    public DeviceNotFoundException(String deviceId) {
        super("DEVICE_NOT_FOUND", "Device " + deviceId + " not found or inactive");
    }
}
