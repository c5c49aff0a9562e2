package com.solarcharge.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveSessionResponse {

    private String sessionId;
    private String userId;
    private String portId;
    private String stationId;
    private String deviceId;
    private Integer portNumber;
    private boolean premium;
    private LocalDateTime startTime;
    private LocalDateTime lastActivity;
    private double energyKwh;
    private double chargeMah;
    private long durationMinutes;
}
