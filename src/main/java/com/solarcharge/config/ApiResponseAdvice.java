package com.solarcharge.config;

import com.solarcharge.api.dto.response.ApiErrorResponse;
import com.solarcharge.api.dto.response.ApiResponse;
import java.util.List;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps controller bodies in {@link ApiResponse}. The health check is left bare so load
 * balancers can read {@code status} at the top level.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final List<String> UNWRAPPED_PREFIXES = List.of("/actuator", "/error", "/api/health");

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // Plain strings go through StringHttpMessageConverter, which cannot write an envelope
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse || isUnwrapped(request)) {
            return body;
        }
        return ApiResponse.of(body);
    }

    private static boolean isUnwrapped(ServerHttpRequest request) {
        String path = request.getURI().getPath();
        return UNWRAPPED_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
