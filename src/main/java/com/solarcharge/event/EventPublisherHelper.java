package com.solarcharge.event;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.enums.TelemetryKind;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.CompletedSession;
import com.solarcharge.domain.model.StaleSweepResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for all
 * coordinator events.
 *
 * <p>Delivery depends on the listener: metrics listeners run synchronously on the
 * publishing thread, system-log listeners run {@code @Async} on the event executor.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Session ----

    public void publishSessionStarted(Object source, ChargingSession session, String deviceId, int portIndex) {
        publishSession(source, ChargingSessionEventType.STARTED, session, deviceId, portIndex);
    }

    public void publishSessionResumed(Object source, ChargingSession session, String deviceId, int portIndex) {
        publishSession(source, ChargingSessionEventType.RESUMED, session, deviceId, portIndex);
    }

    public void publishSessionCompleted(Object source, CompletedSession completed, String deviceId, Integer portIndex) {
        applicationEventPublisher.publishEvent(new ChargingSessionEvent(
                source,
                typeFor(completed.getReason()),
                completed.getSessionId(),
                completed.getUserId(),
                deviceId,
                portIndex,
                completed.getReason(),
                completed.getEnergyKwh(),
                completed.getCost()));
    }

    public void publishStopWithoutSession(Object source, String userId, String deviceId, int portIndex) {
        applicationEventPublisher.publishEvent(new ChargingSessionEvent(
                source, ChargingSessionEventType.STOP_WITHOUT_SESSION, null, userId, deviceId, portIndex, null, 0, null));
    }

    // ---- Telemetry ----

    public void publishUsageAccepted(Object source, String deviceId, int portIndex, double watts) {
        applicationEventPublisher.publishEvent(new TelemetryEvent(
                source, TelemetryEventType.ACCEPTED, TelemetryKind.USAGE, deviceId, portIndex, watts + "W"));
    }

    public void publishTelemetryDropped(
            Object source, TelemetryKind kind, String deviceId, Integer portIndex, String reason) {
        applicationEventPublisher.publishEvent(
                new TelemetryEvent(source, TelemetryEventType.DROPPED, kind, deviceId, portIndex, reason));
    }

    public void publishStationAnnouncement(Object source, TelemetryKind kind, String deviceId, String detail) {
        applicationEventPublisher.publishEvent(
                new TelemetryEvent(source, TelemetryEventType.STATION_ANNOUNCEMENT, kind, deviceId, null, detail));
    }

    // ---- Control ----

    public void publishControlCommand(
            Object source, String deviceId, int portIndex, ControlCommand command, boolean published, String error) {
        applicationEventPublisher.publishEvent(
                new ControlCommandEvent(source, deviceId, portIndex, command, published, error));
    }

    // ---- Reconciliation ----

    public void publishStaleSweep(Object source, StaleSweepResult result) {
        applicationEventPublisher.publishEvent(new StaleSweepEvent(source, result));
    }

    private void publishSession(
            Object source, ChargingSessionEventType type, ChargingSession session, String deviceId, int portIndex) {
        applicationEventPublisher.publishEvent(new ChargingSessionEvent(
                source,
                type,
                session.getId(),
                session.getUserId(),
                deviceId,
                portIndex,
                null,
                session.getEnergyKwh(),
                null));
    }

    private static ChargingSessionEventType typeFor(SessionCloseReason reason) {
        return switch (reason) {
            case USER_STOP -> ChargingSessionEventType.STOPPED;
            case INACTIVITY -> ChargingSessionEventType.AUTO_COMPLETED;
            case STALE_RECONCILIATION -> ChargingSessionEventType.STALE_COMPLETED;
        };
    }
}
