package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.PortStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A durable, independently controllable charging outlet.
 * Provisioned outside this service; the coordinator only updates its status fields.
 */
@Data
@Builder
public class ChargingPort {

    private String id;
    private String stationId;

    /** MQTT client id of the station controller that drives this port. */
    private String deviceId;

    /** Physical index on the device (1-based). */
    private int deviceIndex;

    private boolean premium;
    private PortStatus status;
    private boolean occupied;
    private LocalDateTime lastStatusUpdate;
}
