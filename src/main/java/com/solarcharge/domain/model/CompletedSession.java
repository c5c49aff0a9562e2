package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.SessionCloseReason;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Outcome of a successful ACTIVE to COMPLETED transition. */
@Value
@Builder
public class CompletedSession {

    String sessionId;
    String userId;
    double energyKwh;
    double chargeMah;
    BigDecimal cost;
    LocalDateTime endTime;
    SessionCloseReason reason;
}
