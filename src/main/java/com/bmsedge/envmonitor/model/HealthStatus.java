package com.bmsedge.envmonitor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodic status marker written alongside the readings. Carries no metrics.
 */
@Value
@Builder
public class HealthStatus implements TelemetryDocument {

    public static final String SENSOR_TYPE = "health_status";
    public static final String STATUS_OPTIMAL = "OPTIMAL";

    String id;

    @NonNull
    Instant timestamp;

    @NonNull
    SensorMetadata metadata;

    @NonNull
    @Builder.Default
    String status = STATUS_OPTIMAL;

    @NonNull
    String message;

    @NonNull
    Alert alert;

    @Override
    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    @Override
    public List<Alert> getAlerts() {
        return List.of(alert);
    }
}
