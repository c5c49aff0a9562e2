package com.solarcharge.domain.enums;

/** Outbound relay command published on the control topic. */
public enum ControlCommand {
    ON,
    OFF
}
