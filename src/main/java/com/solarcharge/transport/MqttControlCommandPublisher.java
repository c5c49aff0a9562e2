package com.solarcharge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.exception.ControlPublishException;
import com.solarcharge.telemetry.TelemetryTopics;
import io.github.resilience4j.retry.annotation.Retry;
import java.nio.charset.StandardCharsets;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Publishes {@code {"command":"ON|OFF","port_number":n}} to {@code <prefix>control/<deviceId>}.
 *
 * <p>Runs on the control publish thread, never on the coordinator worker. It waits for the
 * broker to acknowledge the publish so failures surface here; transient failures are
 * retried by the {@code controlPublish} Resilience4j instance.
 */
@Component
@ConditionalOnProperty(name = "solarcharge.mqtt.enabled", havingValue = "true", matchIfMissing = true)
public class MqttControlCommandPublisher implements ControlCommandPublisher {

    private static final Logger log = LoggerFactory.getLogger(MqttControlCommandPublisher.class);

    private final IMqttAsyncClient mqttClient;
    private final TelemetryTopics telemetryTopics;
    private final ObjectMapper objectMapper;
    private final int qos;
    private final long completionTimeoutMs;

    public MqttControlCommandPublisher(
            IMqttAsyncClient mqttClient,
            TelemetryTopics telemetryTopics,
            ObjectMapper objectMapper,
            @Value("${solarcharge.mqtt.qos:1}") int qos,
            @Value("${solarcharge.mqtt.publish-timeout-ms:5000}") long completionTimeoutMs) {
        this.mqttClient = mqttClient;
        this.telemetryTopics = telemetryTopics;
        this.objectMapper = objectMapper;
        this.qos = qos;
        this.completionTimeoutMs = completionTimeoutMs;
    }

    @Override
    @Retry(name = "controlPublish")
    public void publish(String deviceId, int portIndex, ControlCommand command) {
        if (!mqttClient.isConnected()) {
            throw new ControlPublishException("MQTT client not connected, cannot send " + command + " to " + deviceId);
        }
        String topic = telemetryTopics.controlTopic(deviceId);
        MqttMessage message = new MqttMessage(payload(portIndex, command));
        message.setQos(qos);
        try {
            IMqttDeliveryToken token = mqttClient.publish(topic, message);
            token.waitForCompletion(completionTimeoutMs);
            log.info("Control command published: topic={}, command={}, port={}", topic, command, portIndex);
        } catch (MqttException e) {
            throw new ControlPublishException(
                    "Failed to publish " + command + " to " + topic + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return mqttClient.isConnected();
    }

    private byte[] payload(int portIndex, ControlCommand command) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("command", command.name());
        node.put("port_number", portIndex);
        try {
            return objectMapper.writeValueAsString(node).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Control payload serialization failed", e);
        }
    }
}
