package com.bmsedge.envmonitor.dto;

import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryDocumentDTO {

    public static final String KIND_READING = "READING";
    public static final String KIND_HEALTH_STATUS = "HEALTH_STATUS";

    private String id;
    private String kind;
    private Instant timestamp;

    // Location info
    private String location;
    private String building;
    private String room;
    private String sensorId;
    private String sensorType;

    // Readings only
    private Double temperature;
    private Double humidity;

    // Health status only
    private String status;
    private String message;

    private List<AlertDTO> alerts;

    public static TelemetryDocumentDTO from(TelemetryDocument document) {
        SensorMetadata metadata = document.getMetadata();
        TelemetryDocumentDTO dto = TelemetryDocumentDTO.builder()
                .id(document.getId().orElse(null))
                .timestamp(document.getTimestamp())
                .location(metadata.getLocation())
                .building(metadata.getBuilding())
                .room(metadata.getRoom())
                .sensorId(metadata.getSensorId())
                .sensorType(metadata.getSensorType())
                .alerts(document.getAlerts().stream().map(AlertDTO::from).collect(Collectors.toList()))
                .build();

        if (document instanceof SensorReading reading) {
            dto.setKind(KIND_READING);
            dto.setTemperature(reading.getMetrics().getTemperature().orElse(null));
            dto.setHumidity(reading.getMetrics().getHumidity().orElse(null));
        } else if (document instanceof HealthStatus health) {
            dto.setKind(KIND_HEALTH_STATUS);
            dto.setStatus(health.getStatus());
            dto.setMessage(health.getMessage());
        }
        return dto;
    }
}
