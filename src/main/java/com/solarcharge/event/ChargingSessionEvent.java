package com.solarcharge.event;

import com.solarcharge.domain.enums.SessionCloseReason;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every session lifecycle change.
 *
 * <p>Listeners: {@code CoordinatorMetricsService} (session counters) and
 * {@code SystemLogRecorder} (system_logs rows). {@code sessionId} is null for
 * {@link ChargingSessionEventType#STOP_WITHOUT_SESSION}; {@code reason}, {@code energyKwh}
 * and {@code cost} are only meaningful for completions.
 */
@Getter
public class ChargingSessionEvent extends ApplicationEvent {

    private final ChargingSessionEventType eventType;
    private final String sessionId;
    private final String userId;
    private final String deviceId;
    private final Integer portIndex;
    private final SessionCloseReason reason;
    private final double energyKwh;
    private final BigDecimal cost;
    private final LocalDateTime occurredAt;

    public ChargingSessionEvent(
            Object source,
            ChargingSessionEventType eventType,
            String sessionId,
            String userId,
            String deviceId,
            Integer portIndex,
            SessionCloseReason reason,
            double energyKwh,
            BigDecimal cost) {
        super(source);
        this.eventType = eventType;
        this.sessionId = sessionId;
        this.userId = userId;
        this.deviceId = deviceId;
        this.portIndex = portIndex;
        this.reason = reason;
        this.energyKwh = energyKwh;
        this.cost = cost;
        this.occurredAt = LocalDateTime.now();
    }

    public boolean isCompletion() {
        return reason != null;
    }
}
