package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a start or stop request.
 *
 * <p>{@code sessionId} is null for a stop on a port with no active session.
 * {@code commandPublished} means the outbound command was accepted for delivery; the
 * broker outcome is reported asynchronously. It is false when the command was dropped
 * (transport closed, publish queue full). The session transition stands either way.
 */
@Value
@Builder
public class ControlResult {

    String deviceId;
    int portNumber;
    ControlCommand command;
    String sessionId;
    boolean resumed;
    PortStatus portStatus;
    boolean commandPublished;
}
