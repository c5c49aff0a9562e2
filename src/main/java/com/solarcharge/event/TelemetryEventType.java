package com.solarcharge.event;

public enum TelemetryEventType {

    /** Positive usage sample accounted to a session. */
    ACCEPTED,

    /** Message dropped: malformed, unmapped port, missing port index, or no active session. */
    DROPPED,

    /** Station-wide online/offline announcement or generic station status. */
    STATION_ANNOUNCEMENT
}
