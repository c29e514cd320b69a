package com.polkadot.analytics.controller;

import com.polkadot.analytics.exception.AnalyticsException;
import com.polkadot.analytics.exception.ComputationException;
import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.exception.InsufficientDataException;
import com.polkadot.analytics.exception.ModelUnavailableException;
import com.polkadot.analytics.exception.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps analytics failures to HTTP statuses with an {@code {"error": message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> badRequest(ConfigurationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause instanceof ConfigurationException ? cause.getMessage() : "Malformed request body";
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, String>> insufficientData(InsufficientDataException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<Map<String, String>> modelUnavailable(ModelUnavailableException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Map<String, String>> serviceUnavailable(ServiceUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<Map<String, String>> computation(ComputationException e) {
        log.error("Computation failed for {}: {}", e.getModelKey(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<Map<String, String>> analytics(AnalyticsException e) {
        log.error("Analytics request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
