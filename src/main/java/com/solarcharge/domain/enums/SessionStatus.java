package com.solarcharge.domain.enums;

public enum SessionStatus {
    ACTIVE,
    COMPLETED
}
