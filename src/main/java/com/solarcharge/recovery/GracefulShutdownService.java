package com.solarcharge.recovery;

import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.session.CoordinatorWorker;
import com.solarcharge.transport.ControlCommandSender;
import com.solarcharge.transport.MqttTelemetrySubscriber;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown of the coordinator.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs before other
 * Spring components shut down. The sequence:
 * <ol>
 *   <li>Stop telemetry intake (unsubscribe)</li>
 *   <li>Cancel all inactivity timers</li>
 *   <li>Drain and stop the coordinator worker</li>
 *   <li>Finish queued control publishes and stop accepting new ones</li>
 *   <li>Close the store connection pool</li>
 *   <li>Disconnect and close the MQTT client</li>
 * </ol>
 * No control command can be published after the transport is closed: the worker is
 * stopped, its pending timers are discarded, and the sender refuses new commands.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private static final long MQTT_DISCONNECT_TIMEOUT_MS = 5_000;

    private final ChargingCoordinator chargingCoordinator;
    private final CoordinatorWorker coordinatorWorker;
    private final ControlCommandSender controlCommandSender;
    private final ObjectProvider<MqttTelemetrySubscriber> mqttTelemetrySubscriber;
    private final ObjectProvider<IMqttAsyncClient> mqttClient;
    private final ObjectProvider<DataSource> dataSource;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            ChargingCoordinator chargingCoordinator,
            CoordinatorWorker coordinatorWorker,
            ControlCommandSender controlCommandSender,
            ObjectProvider<MqttTelemetrySubscriber> mqttTelemetrySubscriber,
            ObjectProvider<IMqttAsyncClient> mqttClient,
            ObjectProvider<DataSource> dataSource) {
        this.chargingCoordinator = chargingCoordinator;
        this.coordinatorWorker = coordinatorWorker;
        this.controlCommandSender = controlCommandSender;
        this.mqttTelemetrySubscriber = mqttTelemetrySubscriber;
        this.mqttClient = mqttClient;
        this.dataSource = dataSource;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            mqttTelemetrySubscriber.ifAvailable(MqttTelemetrySubscriber::stopIntake);

            // Cancelled on the worker so no timer is mid-fire while the map is cleared
            coordinatorWorker.call(chargingCoordinator::shutdown);
            coordinatorWorker.drain();
            controlCommandSender.shutdown();

            closeDataSource();
            closeMqttClient();

            log.info("Graceful shutdown completed successfully");
        } catch (Exception e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase = earlier shutdown
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void closeDataSource() {
        DataSource ds = dataSource.getIfAvailable();
        if (ds instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.info("Store connection pool closed");
            } catch (Exception e) {
                log.warn("Store connection pool close failed: {}", e.getMessage());
            }
        }
    }

    void closeMqttClient() {
        IMqttAsyncClient client = mqttClient.getIfAvailable();
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect(MQTT_DISCONNECT_TIMEOUT_MS).waitForCompletion(MQTT_DISCONNECT_TIMEOUT_MS);
            }
            client.close();
            log.info("MQTT client disconnected and closed");
        } catch (MqttException e) {
            log.warn("MQTT client close failed: {}", e.getMessage());
        }
    }
}
