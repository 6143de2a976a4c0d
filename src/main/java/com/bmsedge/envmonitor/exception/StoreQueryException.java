package com.bmsedge.envmonitor.exception;

/**
 * A read, delete or aggregation against the store failed.
 */
public class StoreQueryException extends TelemetryStoreException {

    public StoreQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
