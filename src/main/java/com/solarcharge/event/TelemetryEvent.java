package com.solarcharge.event;

import com.solarcharge.domain.enums.TelemetryKind;
import java.time.LocalDateTime;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published by telemetry ingestion for accepted samples, dropped messages and station
 * announcements. {@code detail} is the drop reason or announcement text.
 */
@Getter
public class TelemetryEvent extends ApplicationEvent {

    private final TelemetryEventType eventType;
    private final TelemetryKind kind;
    private final String deviceId;
    private final Integer portIndex;
    private final String detail;
    private final LocalDateTime occurredAt;

    public TelemetryEvent(
            Object source,
            TelemetryEventType eventType,
            TelemetryKind kind,
            String deviceId,
            Integer portIndex,
            String detail) {
        super(source);
        this.eventType = eventType;
        this.kind = kind;
        this.deviceId = deviceId;
        this.portIndex = portIndex;
        this.detail = detail;
        this.occurredAt = LocalDateTime.now();
    }
}
