package com.solarcharge.observability;

import com.solarcharge.domain.enums.LogSource;
import com.solarcharge.domain.enums.LogType;
import com.solarcharge.entity.SystemLogEntity;
import com.solarcharge.event.ChargingSessionEvent;
import com.solarcharge.event.ChargingSessionEventType;
import com.solarcharge.event.ControlCommandEvent;
import com.solarcharge.event.StaleSweepEvent;
import com.solarcharge.event.TelemetryEvent;
import com.solarcharge.repository.jpa.SystemLogJpaRepository;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Persists significant coordinator events to system_logs for operators.
 *
 * <p>Listeners run on the event executor. Writes are best-effort: a failure is logged
 * and dropped.
 */
@Service
public class SystemLogRecorder {

    private static final Logger log = LoggerFactory.getLogger(SystemLogRecorder.class);

    private final SystemLogJpaRepository systemLogJpaRepository;

    public SystemLogRecorder(SystemLogJpaRepository systemLogJpaRepository) {
        this.systemLogJpaRepository = systemLogJpaRepository;
    }

    @Async("eventExecutor")
    @EventListener
    public void onSessionEvent(ChargingSessionEvent event) {
        String message = switch (event.getEventType()) {
            case STARTED -> String.format(
                    "Session %s started on %s port %d", event.getSessionId(), event.getDeviceId(), event.getPortIndex());
            case RESUMED -> String.format(
                    "Session %s resumed on %s port %d", event.getSessionId(), event.getDeviceId(), event.getPortIndex());
            case STOPPED -> String.format(
                    "Session %s stopped by user. Energy %.6f kWh, cost %s",
                    event.getSessionId(), event.getEnergyKwh(), event.getCost());
            case AUTO_COMPLETED -> String.format(
                    "Session %s auto-completed after inactivity. Energy %.6f kWh, cost %s",
                    event.getSessionId(), event.getEnergyKwh(), event.getCost());
            case STALE_COMPLETED -> String.format(
                    "Stale session %s force-completed. Energy %.6f kWh, cost %s",
                    event.getSessionId(), event.getEnergyKwh(), event.getCost());
            case STOP_WITHOUT_SESSION -> String.format(
                    "Stop on %s port %d with no active session, port turned off",
                    event.getDeviceId(), event.getPortIndex());
        };
        LogSource source = event.getEventType() == ChargingSessionEventType.AUTO_COMPLETED
                        || event.getEventType() == ChargingSessionEventType.STALE_COMPLETED
                ? LogSource.BACKEND
                : LogSource.API;
        record(LogType.INFO, source, message, event.getUserId());
    }

    @Async("eventExecutor")
    @EventListener
    public void onTelemetryEvent(TelemetryEvent event) {
        switch (event.getEventType()) {
            case DROPPED -> record(
                    LogType.WARNING,
                    LogSource.MQTT,
                    String.format("Telemetry dropped (%s from %s): %s", event.getKind(), event.getDeviceId(), event.getDetail()),
                    null);
            case STATION_ANNOUNCEMENT -> record(
                    LogType.INFO,
                    LogSource.MQTT,
                    String.format("Station %s: %s", event.getDeviceId(), event.getDetail()),
                    null);
            default -> {
                // accepted samples are too frequent for system_logs
            }
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onControlCommand(ControlCommandEvent event) {
        if (event.isPublished()) {
            return;
        }
        record(
                LogType.ERROR,
                LogSource.MQTT,
                String.format(
                        "Failed to send %s to %s port %d: %s",
                        event.getCommand(), event.getDeviceId(), event.getPortIndex(), event.getError()),
                null);
    }

    @Async("eventExecutor")
    @EventListener
    public void onStaleSweep(StaleSweepEvent event) {
        LogType type = event.getResult().hasFailures() ? LogType.ERROR : LogType.WARNING;
        record(
                type,
                LogSource.BACKEND,
                String.format(
                        "Stale session sweep (%s): found %d, completed %d, already closed %d, failed %d",
                        event.getResult().getTrigger(),
                        event.getResult().getStaleFound(),
                        event.getResult().getCompleted(),
                        event.getResult().getAlreadyClosed(),
                        event.getResult().getFailures().size()),
                null);
    }

    void record(LogType type, LogSource source, String message, String userId) {
        try {
            systemLogJpaRepository.save(SystemLogEntity.builder()
                    .timestamp(LocalDateTime.now())
                    .logType(type)
                    .source(source)
                    .message(message)
                    .userId(userId)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to write system log entry: type={}, message={}", type, message, e);
        }
    }
}
