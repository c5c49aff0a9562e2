package com.solarcharge.transport;

import com.solarcharge.session.CoordinatorWorker;
import com.solarcharge.telemetry.TelemetryIngestionService;
import com.solarcharge.telemetry.TelemetryTopics;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Connects the Paho client once the application is ready, subscribes to the telemetry
 * topics on every (re)connect, and hands each message to the coordinator worker.
 *
 * <p>Paho delivers messages on its own callback thread; nothing is processed there.
 * Reconnection is left to Paho's automatic reconnect.
 */
@Component
@ConditionalOnProperty(name = "solarcharge.mqtt.enabled", havingValue = "true", matchIfMissing = true)
public class MqttTelemetrySubscriber implements MqttCallbackExtended {

    private static final Logger log = LoggerFactory.getLogger(MqttTelemetrySubscriber.class);

    private final IMqttAsyncClient mqttClient;
    private final MqttConnectOptions mqttConnectOptions;
    private final TelemetryTopics telemetryTopics;
    private final TelemetryIngestionService telemetryIngestionService;
    private final CoordinatorWorker coordinatorWorker;
    private final int qos;

    private volatile boolean accepting = true;

    public MqttTelemetrySubscriber(
            IMqttAsyncClient mqttClient,
            MqttConnectOptions mqttConnectOptions,
            TelemetryTopics telemetryTopics,
            TelemetryIngestionService telemetryIngestionService,
            CoordinatorWorker coordinatorWorker,
            @Value("${solarcharge.mqtt.qos:1}") int qos) {
        this.mqttClient = mqttClient;
        this.mqttConnectOptions = mqttConnectOptions;
        this.telemetryTopics = telemetryTopics;
        this.telemetryIngestionService = telemetryIngestionService;
        this.coordinatorWorker = coordinatorWorker;
        this.qos = qos;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connect() {
        mqttClient.setCallback(this);
        try {
            mqttClient.connect(mqttConnectOptions, null, new IMqttActionListener() {
                @Override
                public void onSuccess(IMqttToken asyncActionToken) {
                    log.info("MQTT connect requested successfully: serverURI={}", mqttClient.getServerURI());
                }

                @Override
                public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
                    // Initial connect failures are not retried by automatic reconnect
                    log.error("MQTT initial connect failed: serverURI={}", mqttClient.getServerURI(), exception);
                }
            });
        } catch (MqttException e) {
            log.error("MQTT connect could not be started: serverURI={}", mqttClient.getServerURI(), e);
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        log.info("MQTT connected: serverURI={}, reconnect={}", serverURI, reconnect);
        subscribe();
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("MQTT connection lost: {}", cause != null ? cause.getMessage() : "unknown");
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        if (!accepting) {
            return;
        }
        String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
        log.debug("MQTT message: topic={}, payload={}", topic, payload);
        coordinatorWorker.execute(() -> telemetryIngestionService.ingest(topic, payload));
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // publish acknowledgements are awaited by the publisher
    }

    /** Stops handing messages to the worker and unsubscribes. First step of shutdown. */
    public void stopIntake() {
        accepting = false;
        if (!mqttClient.isConnected()) {
            return;
        }
        List<String> filters = telemetryTopics.subscriptionFilters();
        try {
            mqttClient.unsubscribe(filters.toArray(new String[0])).waitForCompletion(5_000);
            log.info("MQTT telemetry unsubscribed: {}", filters);
        } catch (MqttException e) {
            log.warn("MQTT unsubscribe failed: {}", e.getMessage());
        }
    }

    public boolean isConnected() {
        return mqttClient.isConnected();
    }

    private void subscribe() {
        List<String> filters = telemetryTopics.subscriptionFilters();
        int[] qosLevels = filters.stream().mapToInt(f -> qos).toArray();
        try {
            mqttClient.subscribe(filters.toArray(new String[0]), qosLevels);
            log.info("MQTT telemetry subscribed: {}", filters);
        } catch (MqttException e) {
            log.error("MQTT subscribe failed: filters={}", filters, e);
        }
    }
}
