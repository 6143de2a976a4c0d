package com.bmsedge.envmonitor.model;

/**
 * Field names of the persisted telemetry documents.
 */
public final class TelemetryFields {

    public static final String ID = "_id";
    public static final String TIMESTAMP = "timestamp";

    public static final String METADATA = "metadata";
    public static final String LOCATION = "metadata.location";
    public static final String BUILDING = "metadata.building";
    public static final String ROOM = "metadata.room";
    public static final String SENSOR_ID = "metadata.sensor_id";

    public static final String METRICS = "metrics";
    public static final String TEMPERATURE = "metrics.temperature";
    public static final String HUMIDITY = "metrics.humidity";

    public static final String ALERT_TYPE = "alert_type";
    public static final String ALERT_MESSAGE = "alert_message";
    public static final String SEVERITY = "severity";

    public static final String STATUS = "status";
    public static final String MESSAGE = "message";

    private TelemetryFields() {
        throw new UnsupportedOperationException("Utility class");
    }
}
