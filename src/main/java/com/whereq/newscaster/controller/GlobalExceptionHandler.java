package com.whereq.newscaster.controller;

import com.whereq.newscaster.exception.JobStoreException;
import com.whereq.newscaster.exception.RenderJobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API
 * Provides consistent error responses across all endpoints
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RenderJobException.class)
    public ResponseEntity<Map<String, Object>> handleRenderJobException(
            RenderJobException ex, ServerWebExchange exchange) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Render job error: {}", ex.toString());
        } else {
            log.warn("Render job error: {}", ex.toString());
        }
        Map<String, Object> body = buildErrorBody(status, ex.getKind().name(), ex.getMessage(), exchange);
        if (ex.getJobId() != null) {
            body.put("jobId", ex.getJobId());
        }
        return new ResponseEntity<>(body, status);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(
            WebExchangeBindException ex, ServerWebExchange exchange) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", message);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", message, exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Validation error: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), exchange);
    }

    @ExceptionHandler(JobStoreException.class)
    public ResponseEntity<Map<String, Object>> handleJobStoreException(
            JobStoreException ex, ServerWebExchange exchange) {
        log.error("Job store error: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Job Store Error",
                "Job store is unavailable: " + ex.getMessage(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(
            Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support if the problem persists.", exchange);
    }

    static HttpStatus statusFor(RenderJobException ex) {
        switch (ex.getKind()) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CANCELED:
                return HttpStatus.CONFLICT;
            case TRANSIENT_NETWORK:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case AUTH:
            case UNEXPECTED_RESPONSE:
            case REMOTE_JOB_FAILURE:
            case REHOST_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            case POLLING_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String error, String message, ServerWebExchange exchange) {
        return new ResponseEntity<>(buildErrorBody(status, error, message, exchange), status);
    }

    private Map<String, Object> buildErrorBody(
            HttpStatus status, String error, String message, ServerWebExchange exchange) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", Instant.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", exchange.getRequest().getPath().value());
        return errorResponse;
    }
}
