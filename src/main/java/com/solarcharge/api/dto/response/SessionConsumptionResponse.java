package com.solarcharge.api.dto.response;

import com.solarcharge.domain.enums.SessionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session summary plus its sample series in time order. Duration runs to now while the
 * session is ACTIVE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionConsumptionResponse {

    private String sessionId;
    private String userId;
    private SessionStatus status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private long durationMinutes;
    private double energyKwh;
    private double chargeMah;
    private BigDecimal cost;
    private double averageWatts;
    private int sampleCount;
    private List<ConsumptionPointResponse> samples;
}
