package com.solarcharge.domain.enums;

public enum LogType {
    INFO,
    WARNING,
    ERROR
}
