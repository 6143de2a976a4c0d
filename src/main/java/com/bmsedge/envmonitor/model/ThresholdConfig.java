package com.bmsedge.envmonitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Alert bounds for temperature (°F) and humidity (%). Bounds are inclusive.
 */
@Value
@Builder(toBuilder = true)
public class ThresholdConfig {

    public static final double RECOMMENDED_TEMP_MIN = 50;
    public static final double RECOMMENDED_TEMP_MAX = 100;
    public static final double RECOMMENDED_HUMIDITY_MIN = 20;
    public static final double RECOMMENDED_HUMIDITY_MAX = 80;

    double tempMin;
    double tempMax;
    double humidityMin;
    double humidityMax;

    public static ThresholdConfig serverRoomDefaults() {
        return new ThresholdConfig(63, 80, 40, 60);
    }

    public boolean isInverted() {
        return tempMin >= tempMax || humidityMin >= humidityMax;
    }

    /**
     * Human readable problems with these bounds. Empty when the configuration is sound.
     */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();

        if (tempMin < RECOMMENDED_TEMP_MIN || tempMax > RECOMMENDED_TEMP_MAX) {
            warnings.add("Temperature thresholds are outside recommended range (50°F - 100°F)");
        }
        if (humidityMin < RECOMMENDED_HUMIDITY_MIN || humidityMax > RECOMMENDED_HUMIDITY_MAX) {
            warnings.add("Humidity thresholds are outside recommended range (20% - 80%)");
        }
        if (tempMin >= tempMax) {
            warnings.add("Temperature minimum must be less than maximum");
        }
        if (humidityMin >= humidityMax) {
            warnings.add("Humidity minimum must be less than maximum");
        }

        return warnings;
    }
}
