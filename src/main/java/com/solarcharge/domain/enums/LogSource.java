package com.solarcharge.domain.enums;

public enum LogSource {
    BACKEND,
    MQTT,
    API
}
