package com.solarcharge.domain.enums;

/**
 * Path that transitioned a session to COMPLETED.
 */
public enum SessionCloseReason {
    /** Owner issued a stop through the control API. */
    USER_STOP,
    /** Inactivity timer fired and the store confirmed no activity within the timeout. */
    INACTIVITY,
    /** Periodic sweep found the session idle for more than twice the timeout. */
    STALE_RECONCILIATION
}
