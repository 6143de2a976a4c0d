package com.bmsedge.envmonitor.model;

/**
 * Kinds of alerts a telemetry document can carry.
 */
public enum AlertType {
    TEMPERATURE_LOW("Temperature below minimum threshold"),
    TEMPERATURE_HIGH("Temperature above maximum threshold"),
    HUMIDITY_LOW("Humidity below minimum threshold"),
    HUMIDITY_HIGH("Humidity above maximum threshold"),
    HEALTH_STATUS("System health status");

    private final String description;

    AlertType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
