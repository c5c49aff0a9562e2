package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.ChargerState;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A persisted, validated power reading attributed to a session.
 * Only positive readings are stored.
 */
@Data
@Builder
public class ConsumptionSample {

    private Long id;
    private String sessionId;
    private String deviceId;
    private Integer portIndex;
    private double watts;

    /** Device-reported sample time, or receive time when the device sent none. */
    private LocalDateTime timestamp;

    private ChargerState chargerState;
}
