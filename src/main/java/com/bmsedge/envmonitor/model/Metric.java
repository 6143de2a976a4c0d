package com.bmsedge.envmonitor.model;

import java.util.Locale;

/**
 * Measured quantities, with the document field each one is stored under.
 */
public enum Metric {
    TEMPERATURE("metrics.temperature", "°F"),
    HUMIDITY("metrics.humidity", "%");

    private final String field;
    private final String unit;

    Metric(String field, String unit) {
        this.field = field;
        this.unit = unit;
    }

    public String getField() {
        return field;
    }

    public String getUnit() {
        return unit;
    }

    public static Metric fromName(String name) {
        try {
            return Metric.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown metric: " + name + " (expected temperature or humidity)");
        }
    }
}
