package com.bmsedge.envmonitor.exception;

public class DataExportException extends RuntimeException {

    public DataExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
