package com.bmsedge.envmonitor.exception;

/**
 * The store could not be reached or failed its health check.
 */
public class StoreConnectionException extends TelemetryStoreException {

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
