package com.solarcharge.domain.model;

import com.solarcharge.domain.enums.SessionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One user's occupancy of a port, from activation to termination.
 *
 * <p>The store is the source of truth. At most one session per port is ACTIVE at a time;
 * the store enforces this with a unique active-port column (see
 * {@link com.solarcharge.entity.ChargingSessionEntity}).
 *
 * <p>Energy and charge accumulate from usage telemetry while ACTIVE. Cost is computed
 * once, on the transition to COMPLETED.
 */
@Data
@Builder
public class ChargingSession {

    private String id;
    private String userId;
    private String portId;
    private String stationId;

    private LocalDateTime startTime;

    /** Null while ACTIVE. */
    private LocalDateTime endTime;

    private SessionStatus status;

    private double energyKwh;
    private double chargeMah;

    private BigDecimal cost;

    /** Server time of the last accepted consumption sample, start or resume. */
    private LocalDateTime lastActivity;

    /** Copied from the port at creation; immutable afterwards. */
    private boolean premium;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
