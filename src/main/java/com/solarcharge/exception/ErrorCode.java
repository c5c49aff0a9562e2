package com.solarcharge.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Error codes exposed on the API. Retryable codes mark store or broker outages. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    MALFORMED_TELEMETRY("MALFORMED_TELEMETRY", 400, false),
    NOT_SESSION_OWNER("NOT_SESSION_OWNER", 403, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    PORT_NOT_FOUND("PORT_NOT_FOUND", 404, false),
    PORT_OCCUPIED("PORT_OCCUPIED", 409, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    CONTROL_PUBLISH_FAILED("CONTROL_PUBLISH_FAILED", 502, true),
    TRANSIENT_IO("TRANSIENT_IO", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
