package com.homepurse.analysis.controller.dto;

import com.homepurse.analysis.security.RequestContextHolder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error envelope shared by the controller advice and the security entry points. Detail values may
 * be null, for example an OAuth2 error without a description.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Stamps the trace id of the current request.
     */
    public static ErrorResponseDto of(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, RequestContextHolder.traceId().orElse(null));
    }
}
