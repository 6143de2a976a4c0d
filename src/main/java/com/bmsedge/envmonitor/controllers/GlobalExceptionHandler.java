package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.exception.DataExportException;
import com.bmsedge.envmonitor.exception.InvalidThresholdException;
import com.bmsedge.envmonitor.exception.TelemetryStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidThresholdException.class)
    public ResponseEntity<Object> handleInvalidThresholds(InvalidThresholdException ex) {
        log.warn("⚠️ Threshold update rejected: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", Instant.now(),
                "status", 400,
                "error", "Invalid Thresholds",
                "message", ex.getMessage(),
                "warnings", ex.getWarnings()
        ));
    }

    // Bad windows, unknown metrics, unparseable parameters
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Object> handleBadRequest(Exception ex) {
        log.warn("⚠️ Bad request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    // Connection, query and write failures alike
    @ExceptionHandler(TelemetryStoreException.class)
    public ResponseEntity<Object> handleStoreUnavailable(TelemetryStoreException ex) {
        log.error("❌ Store unavailable: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable", ex.getMessage());
    }

    @ExceptionHandler(DataExportException.class)
    public ResponseEntity<Object> handleExportFailure(DataExportException ex) {
        log.error("❌ Export failed: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Export Failed", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("❌ Unexpected error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please check the server logs.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", error,
                "message", Objects.toString(message, "")
        ));
    }
}
