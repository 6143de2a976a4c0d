package com.bmsedge.envmonitor.repository;

import com.bmsedge.envmonitor.model.Alert;
import com.bmsedge.envmonitor.model.AlertType;
import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import com.bmsedge.envmonitor.model.Severity;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import static com.bmsedge.envmonitor.model.TelemetryFields.ALERT_MESSAGE;
import static com.bmsedge.envmonitor.model.TelemetryFields.ALERT_TYPE;
import static com.bmsedge.envmonitor.model.TelemetryFields.ID;
import static com.bmsedge.envmonitor.model.TelemetryFields.MESSAGE;
import static com.bmsedge.envmonitor.model.TelemetryFields.METADATA;
import static com.bmsedge.envmonitor.model.TelemetryFields.METRICS;
import static com.bmsedge.envmonitor.model.TelemetryFields.SEVERITY;
import static com.bmsedge.envmonitor.model.TelemetryFields.STATUS;
import static com.bmsedge.envmonitor.model.TelemetryFields.TIMESTAMP;

/**
 * Converts typed telemetry documents to and from their persisted BSON shape.
 * <p>
 * Alerts are stored as three index-aligned arrays ({@code alert_type}, {@code alert_message},
 * {@code severity}); documents without alerts omit all three fields.
 */
@Component
@Slf4j
public class TelemetryDocumentMapper {

    public Document toDocument(TelemetryDocument telemetry) {
        Document doc = new Document();
        telemetry.getId().ifPresent(id -> doc.put(ID, toObjectId(id)));
        doc.put(TIMESTAMP, Date.from(telemetry.getTimestamp()));
        doc.put(METADATA, toMetadataDocument(telemetry.getMetadata()));

        if (telemetry instanceof SensorReading reading) {
            doc.put(METRICS, toMetricsDocument(reading.getMetrics()));
        } else if (telemetry instanceof HealthStatus health) {
            doc.put(STATUS, health.getStatus());
            doc.put(MESSAGE, health.getMessage());
        }

        putAlerts(doc, telemetry.getAlerts());
        return doc;
    }

    public TelemetryDocument fromDocument(Document doc) {
        String id = readId(doc.get(ID));
        Instant timestamp = readTimestamp(doc.get(TIMESTAMP));
        SensorMetadata metadata = readMetadata(doc.get(METADATA, Document.class));
        List<Alert> alerts = readAlerts(doc);

        if (doc.containsKey(STATUS)) {
            Alert alert = alerts.stream()
                    .filter(a -> a.getType() == AlertType.HEALTH_STATUS)
                    .findFirst()
                    .orElseGet(() -> Alert.builder()
                            .type(AlertType.HEALTH_STATUS)
                            .message(AlertType.HEALTH_STATUS.getDescription())
                            .severity(Severity.INFO)
                            .build());
            return HealthStatus.builder()
                    .id(id)
                    .timestamp(timestamp)
                    .metadata(metadata)
                    .status(doc.getString(STATUS))
                    .message(doc.get(MESSAGE) != null ? doc.get(MESSAGE).toString() : "")
                    .alert(alert)
                    .build();
        }

        return SensorReading.builder()
                .id(id)
                .timestamp(timestamp)
                .metadata(metadata)
                .metrics(readMetrics(doc.get(METRICS, Document.class)))
                .alerts(alerts)
                .build();
    }

    public Object toObjectId(String id) {
        return ObjectId.isValid(id) ? new ObjectId(id) : id;
    }

    private Document toMetadataDocument(SensorMetadata metadata) {
        Document md = new Document();
        putIfPresent(md, "location", metadata.getLocation());
        putIfPresent(md, "building", metadata.getBuilding());
        putIfPresent(md, "room", metadata.getRoom());
        putIfPresent(md, "sensor_id", metadata.getSensorId());
        putIfPresent(md, "sensor_type", metadata.getSensorType());
        return md;
    }

    private Document toMetricsDocument(Metrics metrics) {
        Document md = new Document();
        metrics.getTemperature().ifPresent(v -> md.put("temperature", v));
        metrics.getHumidity().ifPresent(v -> md.put("humidity", v));
        return md;
    }

    private void putAlerts(Document doc, List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return;
        }
        List<String> types = new ArrayList<>(alerts.size());
        List<String> messages = new ArrayList<>(alerts.size());
        List<String> severities = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            types.add(alert.getType().name());
            messages.add(alert.getMessage());
            severities.add(alert.getSeverity().name());
        }
        doc.put(ALERT_TYPE, types);
        doc.put(ALERT_MESSAGE, messages);
        doc.put(SEVERITY, severities);
    }

    private static void putIfPresent(Document doc, String key, String value) {
        if (value != null) {
            doc.put(key, value);
        }
    }

    private static String readId(Object raw) {
        if (raw == null) {
            return null;
        }
        return raw instanceof ObjectId objectId ? objectId.toHexString() : raw.toString();
    }

    private static Instant readTimestamp(Object raw) {
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        throw new IllegalArgumentException("Telemetry document has no usable timestamp: " + raw);
    }

    private static SensorMetadata readMetadata(Document md) {
        if (md == null) {
            return SensorMetadata.builder().build();
        }
        return SensorMetadata.builder()
                .location(md.getString("location"))
                .building(md.getString("building"))
                .room(md.getString("room"))
                .sensorId(md.getString("sensor_id"))
                .sensorType(md.getString("sensor_type") != null ? md.getString("sensor_type") : md.getString("type"))
                .build();
    }

    private static Metrics readMetrics(Document md) {
        if (md == null) {
            return Metrics.empty();
        }
        return Metrics.of(readDouble(md.get("temperature")), readDouble(md.get("humidity")));
    }

    private static Double readDouble(Object raw) {
        return raw instanceof Number number ? number.doubleValue() : null;
    }

    private List<Alert> readAlerts(Document doc) {
        List<String> types = readStrings(doc.get(ALERT_TYPE));
        if (types.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> messages = readStrings(doc.get(ALERT_MESSAGE));
        List<String> severities = readStrings(doc.get(SEVERITY));

        List<Alert> alerts = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            AlertType type;
            try {
                type = AlertType.valueOf(types.get(i));
            } catch (IllegalArgumentException e) {
                log.warn("⚠️ Skipping unknown alert type '{}' in document {}", types.get(i), doc.get(ID));
                continue;
            }
            String message = i < messages.size() ? messages.get(i) : type.getDescription();
            Severity severity = i < severities.size() ? parseSeverity(severities.get(i)) : Severity.INFO;
            alerts.add(Alert.builder().type(type).message(message).severity(severity).build());
        }
        return alerts;
    }

    private static Severity parseSeverity(String raw) {
        try {
            return Severity.valueOf(raw);
        } catch (IllegalArgumentException e) {
            return Severity.INFO;
        }
    }

    // Legacy health documents stored scalars instead of arrays.
    private static List<String> readStrings(Object raw) {
        if (raw == null) {
            return Collections.emptyList();
        }
        if (raw instanceof List<?> list) {
            List<String> values = new ArrayList<>(list.size());
            for (Object item : list) {
                values.add(item == null ? "" : item.toString());
            }
            return values;
        }
        return List.of(raw.toString());
    }
}
