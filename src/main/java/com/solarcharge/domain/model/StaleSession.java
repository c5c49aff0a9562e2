package com.solarcharge.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * An ACTIVE session found idle beyond the reconciliation cutoff, together with the
 * device coordinates needed to turn its port off. Device fields are null when the
 * port row has no device mapping.
 */
@Value
@Builder
public class StaleSession {

    ChargingSession session;
    String deviceId;
    Integer deviceIndex;
    long secondsSinceActivity;

    public boolean hasDevice() {
        return deviceId != null && deviceIndex != null && deviceIndex > 0;
    }
}
