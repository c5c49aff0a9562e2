package com.solarcharge.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.solarcharge.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Failure body rendered by {@code GlobalExceptionHandler}:
 * {@code {"success":false,"error":{code,message,details,timestamp,path}}}.
 */
@Value
public class ApiErrorResponse {

    boolean success;
    Failure error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(
                false,
                Failure.builder()
                        .code(errorCode.getCode())
                        .message(message)
                        .details(details == null || details.isEmpty() ? null : details)
                        .timestamp(Instant.now())
                        .path(path)
                        .build());
    }

    /** Machine-readable code plus request context. {@code details} is omitted when empty. */
    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Failure {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
