package com.solarcharge.transport;

import com.solarcharge.config.AsyncConfig;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.event.EventPublisherHelper;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;
import org.springframework.stereotype.Component;

/**
 * Best-effort command delivery for the coordinator. Session transitions are already
 * committed when this runs.
 *
 * <p>{@link #send} only hands the command to the single-thread publish executor, so the
 * coordinator worker never waits on the broker or on publish retries. The delivery
 * outcome is reported as a control command event. Commands keep their submission order.
 */
@Component
public class ControlCommandSender {

    private static final Logger log = LoggerFactory.getLogger(ControlCommandSender.class);

    private final ControlCommandPublisher controlCommandPublisher;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskExecutor publishExecutor;

    private volatile boolean stopped;

    public ControlCommandSender(
            ControlCommandPublisher controlCommandPublisher,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier(AsyncConfig.CONTROL_PUBLISH_EXECUTOR) TaskExecutor publishExecutor) {
        this.controlCommandPublisher = controlCommandPublisher;
        this.eventPublisherHelper = eventPublisherHelper;
        this.publishExecutor = publishExecutor;
    }

    /** @return true if the command was accepted for delivery */
    public boolean send(String deviceId, int portIndex, ControlCommand command) {
        if (stopped) {
            return rejected(deviceId, portIndex, command, "Transport closed");
        }
        try {
            publishExecutor.execute(() -> deliver(deviceId, portIndex, command));
            return true;
        } catch (RejectedExecutionException e) {
            return rejected(deviceId, portIndex, command, "Publish queue rejected the command: " + e.getMessage());
        }
    }

    /**
     * Stops accepting commands and waits for queued publishes to finish. Called before the
     * MQTT client is closed.
     */
    public void shutdown() {
        stopped = true;
        if (publishExecutor instanceof ExecutorConfigurationSupport executor) {
            executor.shutdown();
        }
        log.info("Control command sender stopped");
    }

    public boolean isTransportConnected() {
        return controlCommandPublisher.isConnected();
    }

    void deliver(String deviceId, int portIndex, ControlCommand command) {
        try {
            controlCommandPublisher.publish(deviceId, portIndex, command);
            eventPublisherHelper.publishControlCommand(this, deviceId, portIndex, command, true, null);
        } catch (RuntimeException e) {
            log.error(
                    "Control command not delivered: deviceId={}, port={}, command={}, error={}",
                    deviceId,
                    portIndex,
                    command,
                    e.getMessage());
            eventPublisherHelper.publishControlCommand(this, deviceId, portIndex, command, false, e.getMessage());
        }
    }

    private boolean rejected(String deviceId, int portIndex, ControlCommand command, String reason) {
        log.warn("Control command dropped: deviceId={}, port={}, command={}, reason={}",
                deviceId, portIndex, command, reason);
        eventPublisherHelper.publishControlCommand(this, deviceId, portIndex, command, false, reason);
        return false;
    }
}
