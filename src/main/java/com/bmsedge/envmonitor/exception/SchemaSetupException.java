package com.bmsedge.envmonitor.exception;

public class SchemaSetupException extends TelemetryStoreException {

    public SchemaSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
