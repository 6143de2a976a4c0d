package com.bmsedge.envmonitor.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Optional;

/**
 * Temperature and humidity of one reading. Either value may be missing.
 */
@EqualsAndHashCode
@ToString
public final class Metrics {

    private static final Metrics EMPTY = new Metrics(null, null);

    private final Double temperature;
    private final Double humidity;

    private Metrics(Double temperature, Double humidity) {
        this.temperature = temperature;
        this.humidity = humidity;
    }

    public static Metrics of(Double temperature, Double humidity) {
        if (temperature == null && humidity == null) {
            return EMPTY;
        }
        return new Metrics(temperature, humidity);
    }

    public static Metrics empty() {
        return EMPTY;
    }

    public Optional<Double> getTemperature() {
        return Optional.ofNullable(temperature);
    }

    public Optional<Double> getHumidity() {
        return Optional.ofNullable(humidity);
    }

    public Optional<Double> get(Metric metric) {
        return switch (metric) {
            case TEMPERATURE -> getTemperature();
            case HUMIDITY -> getHumidity();
        };
    }

    public boolean isEmpty() {
        return temperature == null && humidity == null;
    }
}
