package com.solarcharge.exception;

import java.util.Map;

/** No port is provisioned for the given (device, index) pair. */
public class PortNotFoundException extends BaseException {

    public PortNotFoundException(String deviceId, Integer deviceIndex) {
        super(
                ErrorCode.PORT_NOT_FOUND,
                String.format("No port mapped for device %s index %s", deviceId, deviceIndex),
                Map.of("deviceId", String.valueOf(deviceId), "portNumber", String.valueOf(deviceIndex)));
    }
}
