package com.bmsedge.envmonitor.exception;

/**
 * Base type for failures talking to the telemetry store.
 */
public class TelemetryStoreException extends RuntimeException {

    public TelemetryStoreException(String message) {
        super(message);
    }

    public TelemetryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
