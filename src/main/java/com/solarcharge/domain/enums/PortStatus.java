package com.solarcharge.domain.enums;

/**
 * Persisted usability state of a charging port.
 *
 * <p>Derived from telemetry or control commands by
 * {@link com.solarcharge.port.PortStatusMapper}; never set from raw strings.
 */
public enum PortStatus {
    AVAILABLE,
    CHARGING_FREE,
    CHARGING_PREMIUM,
    OFFLINE,
    MAINTENANCE,
    OCCUPIED,
    FAULT;

    /** True for any charging variant and for OCCUPIED. Drives the port's occupied flag. */
    public boolean isOccupied() {
        return this == CHARGING_FREE || this == CHARGING_PREMIUM || this == OCCUPIED;
    }
}
