package com.solarcharge.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;
    private Instant timestamp;
    private int trackedSessions;
    private int armedTimers;
    private boolean mqttConnected;
}
