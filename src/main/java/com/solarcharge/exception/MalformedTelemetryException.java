package com.solarcharge.exception;

/** Telemetry topic or payload could not be interpreted. Ingestion drops the message. */
public class MalformedTelemetryException extends BaseException {

    public MalformedTelemetryException(String message) {
        super(ErrorCode.MALFORMED_TELEMETRY, message);
    }

    public MalformedTelemetryException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_TELEMETRY, message, cause);
    }
}
