package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.ChargerState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Parsed {@code status/{deviceId}} message.
 *
 * <p>A bare {@code "offline"} payload (the firmware's last-will message) is parsed as a
 * station-wide status: connectivity "offline", charger UNKNOWN, port index -1.
 */
@Value
@Builder
public class StatusTelemetry {

    String deviceId;
    Integer portIndex;

    /** Connectivity as sent by the device, e.g. "online" or "offline". */
    String connectivity;

    ChargerState chargerState;
    LocalDateTime timestamp;

    public boolean isStationAnnouncement() {
        return "online".equalsIgnoreCase(connectivity) || "offline".equalsIgnoreCase(connectivity);
    }
}
