package com.solarcharge.api.dto.response;

import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.enums.PortStatus;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last reported device status for a port, with the port's persisted status and its
 * ACTIVE session's running totals when there is one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusResponse {

    private String deviceId;
    private String portId;
    private Integer portNumber;
    private String statusMessage;
    private ChargerState chargerState;
    private PortStatus portStatus;
    private LocalDateTime lastUpdate;
    private String activeSessionId;
    private Double energyKwh;
    private Double chargeMah;
}
