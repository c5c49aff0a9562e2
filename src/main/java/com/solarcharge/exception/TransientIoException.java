package com.solarcharge.exception;

/** The store or the coordinator worker was unavailable. Callers may retry. */
public class TransientIoException extends BaseException {

    public TransientIoException(String message) {
        super(ErrorCode.TRANSIENT_IO, message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_IO, message, cause);
    }
}
