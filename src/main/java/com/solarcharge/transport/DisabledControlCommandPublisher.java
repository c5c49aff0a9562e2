package com.solarcharge.transport;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.exception.ControlPublishException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Stands in when MQTT is disabled: every publish is reported as failed. */
@Component
@ConditionalOnProperty(name = "solarcharge.mqtt.enabled", havingValue = "false")
public class DisabledControlCommandPublisher implements ControlCommandPublisher {

    @Override
    public void publish(String deviceId, int portIndex, ControlCommand command) {
        throw new ControlPublishException("MQTT disabled, " + command + " for " + deviceId + " port " + portIndex
                + " not sent");
    }

    @Override
    public boolean isConnected() {
        return false;
    }
}
