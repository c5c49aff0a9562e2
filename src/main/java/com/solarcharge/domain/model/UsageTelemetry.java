package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.ChargerState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Parsed {@code usage/{deviceId}} message.
 *
 * <p>{@code consumptionWatts} is NaN when the payload carried no numeric reading;
 * validation clamps it later rather than rejecting the message.
 */
@Value
@Builder
public class UsageTelemetry {

    String deviceId;

    /** Null when the payload carried no port number. */
    Integer portIndex;

    double consumptionWatts;
    ChargerState chargerState;
    LocalDateTime timestamp;
}
