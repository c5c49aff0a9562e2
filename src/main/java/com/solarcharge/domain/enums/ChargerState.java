package com.solarcharge.domain.enums;

/**
 * Charger relay state as reported by the station firmware.
 * Anything the firmware sends that is not ON or OFF is UNKNOWN.
 */
public enum ChargerState {
    ON,
    OFF,
    UNKNOWN;

    public static ChargerState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase()) {
            case "ON" -> ON;
            case "OFF" -> OFF;
            default -> UNKNOWN;
        };
    }
}
