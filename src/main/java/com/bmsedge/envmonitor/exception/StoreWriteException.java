package com.bmsedge.envmonitor.exception;

public class StoreWriteException extends TelemetryStoreException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
