package com.bmsedge.envmonitor.exception;

import java.util.List;

/**
 * Rejected threshold update. Carries every validation warning of the rejected bounds.
 */
public class InvalidThresholdException extends RuntimeException {

    private final List<String> warnings;

    public InvalidThresholdException(List<String> warnings) {
        super("Invalid thresholds: " + String.join("; ", warnings));
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
