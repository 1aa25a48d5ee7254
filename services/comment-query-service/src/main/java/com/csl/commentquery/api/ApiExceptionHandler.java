package com.csl.commentquery.api;

import com.csl.commentquery.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidQueryVarsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQueryVars(
        InvalidQueryVarsException ex,
        HttpServletRequest request
    ) {
        RequestIds ids = RequestIds.from(request);
        log.debug("rejected query vars trace_id={}: {}", ids.getTraceId(), ex.getMessage());
        return ResponseEntity.badRequest().body(ids.error("bad_request", ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
        HttpMessageNotReadableException ex,
        HttpServletRequest request
    ) {
        RequestIds ids = RequestIds.from(request);
        String details = ex.getMostSpecificCause().getMessage();
        log.debug("unreadable query vars trace_id={}: {}", ids.getTraceId(), details);
        return ResponseEntity.badRequest().body(ids.error("bad_request", "Invalid request body", details));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(
        HttpMediaTypeNotSupportedException ex,
        HttpServletRequest request
    ) {
        RequestIds ids = RequestIds.from(request);
        String details = ex.getContentType() == null ? null : "content type " + ex.getContentType();
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
            .body(ids.error("unsupported_media_type", "Query vars must be sent as application/json", details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        RequestIds ids = RequestIds.from(request);
        log.error("comment query failed on {} trace_id={}", request.getRequestURI(), ids.getTraceId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ids.error("internal_error", "Unexpected error", null));
    }
}
