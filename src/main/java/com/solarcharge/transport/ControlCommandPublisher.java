package com.solarcharge.transport;

import com.solarcharge.domain.enums.ControlCommand;

/**
 * Delivers a control command to a station controller.
 */
public interface ControlCommandPublisher {

    /**
     * @throws com.solarcharge.exception.ControlPublishException if the transport did not
     *     accept the message
     */
    void publish(String deviceId, int portIndex, ControlCommand command);

    boolean isConnected();
}
