package com.bmsedge.envmonitor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class SensorReading implements TelemetryDocument {

    String id;

    @NonNull
    Instant timestamp;

    @NonNull
    SensorMetadata metadata;

    @NonNull
    @Builder.Default
    Metrics metrics = Metrics.empty();

    @Singular
    List<Alert> alerts;

    @Override
    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public SensorReading withAlerts(List<Alert> newAlerts) {
        return toBuilder().clearAlerts().alerts(newAlerts).build();
    }
}
