package com.solarcharge.api.dto.response;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a control request. {@code sessionId} is null for an OFF with no active session;
 * {@code commandPublished=true} means the command was queued for the broker;
 * {@code false} means it was dropped and the device may not switch although the session
 * state changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlResponse {

    private String deviceId;
    private int portNumber;
    private ControlCommand command;
    private String sessionId;
    private boolean resumed;
    private PortStatus portStatus;
    private boolean commandPublished;
}
