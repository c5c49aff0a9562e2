package com.solarcharge.event;

import com.solarcharge.domain.enums.ControlCommand;
import java.time.LocalDateTime;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every outbound control command attempt, whether or not the transport
 * accepted it.
 */
@Getter
public class ControlCommandEvent extends ApplicationEvent {

    private final String deviceId;
    private final int portIndex;
    private final ControlCommand command;
    private final boolean published;
    private final String error;
    private final LocalDateTime occurredAt;

    public ControlCommandEvent(
            Object source, String deviceId, int portIndex, ControlCommand command, boolean published, String error) {
        super(source);
        this.deviceId = deviceId;
        this.portIndex = portIndex;
        this.command = command;
        this.published = published;
        this.error = error;
        this.occurredAt = LocalDateTime.now();
    }
}
