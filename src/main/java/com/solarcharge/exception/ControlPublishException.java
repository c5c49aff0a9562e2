package com.solarcharge.exception;

/**
 * Publishing a control command to the broker failed. Thrown by publishers so the retry
 * layer can act; the command sender converts it to a {@code false} result.
 */
public class ControlPublishException extends BaseException {

    public ControlPublishException(String message) {
        super(ErrorCode.CONTROL_PUBLISH_FAILED, message);
    }

    public ControlPublishException(String message, Throwable cause) {
        super(ErrorCode.CONTROL_PUBLISH_FAILED, message, cause);
    }
}
