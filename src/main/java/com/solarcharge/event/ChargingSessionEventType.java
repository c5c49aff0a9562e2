package com.solarcharge.event;

/**
 * Classifies the session lifecycle change carried by a {@link ChargingSessionEvent}.
 */
public enum ChargingSessionEventType {

    /** New ACTIVE session created by a start request. */
    STARTED,

    /** Start request by the owner of an already ACTIVE session. */
    RESUMED,

    /** Owner stopped the session. */
    STOPPED,

    /** Inactivity timer confirmed no activity and completed the session. */
    AUTO_COMPLETED,

    /** Reconciler sweep force-completed an idle session. */
    STALE_COMPLETED,

    /** Stop request on a port with no ACTIVE session; the port was still turned off. */
    STOP_WITHOUT_SESSION
}
