package com.solarcharge.domain.enums;

/** Category of an inbound pub/sub message, derived from its topic. */
public enum TelemetryKind {
    USAGE,
    STATUS,
    STATION
}
