package com.solarcharge.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.model.StatusTelemetry;
import com.solarcharge.domain.model.UsageTelemetry;
import com.solarcharge.exception.MalformedTelemetryException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * Parses station JSON payloads. Missing or non-numeric fields become nulls/NaN rather
 * than errors; only payloads that are not JSON objects are rejected.
 */
@Component
public class TelemetryParser {

    static final String OFFLINE_LITERAL = "offline";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TelemetryParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public UsageTelemetry parseUsage(String deviceId, String payload) {
        JsonNode node = readObject(payload);
        return UsageTelemetry.builder()
                .deviceId(deviceId)
                .portIndex(portNumber(node))
                .consumptionWatts(consumption(node))
                .chargerState(ChargerState.fromWire(text(node, "charger_state")))
                .timestamp(timestamp(node))
                .build();
    }

    /** A bare {@code offline} payload is the firmware's last-will message for the whole station. */
    public StatusTelemetry parseStatus(String deviceId, String payload) {
        if (payload != null && OFFLINE_LITERAL.equals(payload.trim())) {
            return StatusTelemetry.builder()
                    .deviceId(deviceId)
                    .portIndex(-1)
                    .connectivity(OFFLINE_LITERAL)
                    .chargerState(ChargerState.UNKNOWN)
                    .timestamp(LocalDateTime.now(clock))
                    .build();
        }
        JsonNode node = readObject(payload);
        return StatusTelemetry.builder()
                .deviceId(deviceId)
                .portIndex(portNumber(node))
                .connectivity(text(node, "status"))
                .chargerState(ChargerState.fromWire(text(node, "charger_state")))
                .timestamp(timestamp(node))
                .build();
    }

    private JsonNode readObject(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedTelemetryException("Empty payload");
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new MalformedTelemetryException("Payload is not a JSON object: " + abbreviate(payload));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedTelemetryException("Unparseable payload: " + abbreviate(payload), e);
        }
    }

    private static Integer portNumber(JsonNode node) {
        JsonNode value = node.get("port_number");
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return integral(value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return integral(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // 1 and 1.0 are the same port; 1.5 is not a port
    private static Integer integral(double value) {
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return null;
        }
        return (int) value;
    }

    private static double consumption(JsonNode node) {
        JsonNode value = node.get("consumption");
        if (value == null || value.isNull()) {
            return Double.NaN;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private LocalDateTime timestamp(JsonNode node) {
        JsonNode value = node.get("timestamp");
        if (value == null || !value.isNumber() || value.longValue() <= 0) {
            return LocalDateTime.now(clock);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(value.longValue()), clock.getZone());
    }

    static String abbreviate(String payload) {
        return payload.length() > 200 ? payload.substring(0, 200) + "..." : payload;
    }
}
