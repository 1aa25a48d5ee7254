package com.csl.commentquery.api;

import com.csl.commentquery.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

final class RequestIds {
    static final String TRACE_HEADER = "x-trace-id";
    static final String REQUEST_HEADER = "x-request-id";

    private final String traceId;
    private final String requestId;

    private RequestIds(String traceId, String requestId) {
        this.traceId = traceId;
        this.requestId = requestId;
    }

    static RequestIds from(HttpServletRequest request) {
        return new RequestIds(
            headerOrRandom(request, TRACE_HEADER),
            headerOrRandom(request, REQUEST_HEADER)
        );
    }

    ErrorResponse error(String code, String message, String details) {
        return new ErrorResponse(code, message, details, traceId, requestId);
    }

    String getTraceId() {
        return traceId;
    }

    String getRequestId() {
        return requestId;
    }

    private static String headerOrRandom(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        if (value == null || value.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return value.trim();
    }
}
