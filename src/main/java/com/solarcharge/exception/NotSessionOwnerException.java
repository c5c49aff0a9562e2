package com.solarcharge.exception;

import java.util.Map;

public class NotSessionOwnerException extends BaseException {

    public NotSessionOwnerException(String sessionId, String userId) {
        super(
                ErrorCode.NOT_SESSION_OWNER,
                "User " + userId + " does not own session " + sessionId,
                Map.of("sessionId", sessionId));
    }
}
