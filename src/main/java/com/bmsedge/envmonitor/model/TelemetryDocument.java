package com.bmsedge.envmonitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A document of the telemetry collection: either a {@link SensorReading}
 * or a {@link HealthStatus}.
 */
public interface TelemetryDocument {

    /**
     * Store-assigned id, present once the document has been read back.
     */
    Optional<String> getId();

    Instant getTimestamp();

    SensorMetadata getMetadata();

    List<Alert> getAlerts();

    default boolean hasAlerts() {
        return !getAlerts().isEmpty();
    }
}
