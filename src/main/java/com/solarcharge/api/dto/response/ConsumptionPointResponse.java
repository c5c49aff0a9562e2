package com.solarcharge.api.dto.response;

import com.solarcharge.domain.enums.ChargerState;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionPointResponse {

    private String sessionId;
    private LocalDateTime timestamp;
    private double watts;
    private ChargerState chargerState;
}
