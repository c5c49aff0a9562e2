package com.solarcharge.telemetry;

import com.solarcharge.domain.enums.TelemetryKind;
import com.solarcharge.exception.MalformedTelemetryException;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Topic layout shared by the station firmware and this service.
 *
 * <ul>
 *   <li>{@code <prefix>usage/<deviceId>}: consumption samples</li>
 *   <li>{@code <prefix>status/<deviceId>}: connectivity and charger state</li>
 *   <li>{@code <prefix>control/<deviceId>}: outbound commands</li>
 *   <li>{@code station/<deviceId>/status}: generic station status, unprefixed</li>
 * </ul>
 */
@Component
public class TelemetryTopics {

    public record ParsedTopic(TelemetryKind kind, String deviceId) {}

    private final String prefix;

    public TelemetryTopics(@Value("${solarcharge.mqtt.topic-prefix:charger/}") String prefix) {
        this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }

    public List<String> subscriptionFilters() {
        return List.of(prefix + "usage/+", prefix + "status/+", "station/+/status");
    }

    public String controlTopic(String deviceId) {
        return prefix + "control/" + deviceId;
    }

    public ParsedTopic parse(String topic) {
        if (topic == null) {
            throw new MalformedTelemetryException("Missing topic");
        }
        if (topic.startsWith(prefix)) {
            String[] parts = topic.substring(prefix.length()).split("/");
            if (parts.length == 2 && !parts[1].isBlank()) {
                if ("usage".equals(parts[0])) {
                    return new ParsedTopic(TelemetryKind.USAGE, parts[1]);
                }
                if ("status".equals(parts[0])) {
                    return new ParsedTopic(TelemetryKind.STATUS, parts[1]);
                }
            }
        }
        String[] parts = topic.split("/");
        if (parts.length == 3 && "station".equals(parts[0]) && "status".equals(parts[2]) && !parts[1].isBlank()) {
            return new ParsedTopic(TelemetryKind.STATION, parts[1]);
        }
        throw new MalformedTelemetryException("Unrecognised topic: " + topic);
    }
}
