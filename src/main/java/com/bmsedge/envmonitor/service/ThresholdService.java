package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.exception.InvalidThresholdException;
import com.bmsedge.envmonitor.model.ThresholdConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the thresholds in effect. Changes are kept in memory only.
 */
@Service
@Slf4j
public class ThresholdService {

    private final AtomicReference<ThresholdConfig> current;

    public ThresholdService(@Value("${telemetry.thresholds.temp-min:63}") double tempMin,
                            @Value("${telemetry.thresholds.temp-max:80}") double tempMax,
                            @Value("${telemetry.thresholds.humidity-min:40}") double humidityMin,
                            @Value("${telemetry.thresholds.humidity-max:60}") double humidityMax) {
        ThresholdConfig initial = ThresholdConfig.builder()
                .tempMin(tempMin)
                .tempMax(tempMax)
                .humidityMin(humidityMin)
                .humidityMax(humidityMax)
                .build();
        if (initial.isInverted()) {
            throw new InvalidThresholdException(initial.validate());
        }
        initial.validate().forEach(w -> log.warn("⚠️ Threshold Warning: {}", w));
        this.current = new AtomicReference<>(initial);
    }

    public ThresholdConfig current() {
        return current.get();
    }

    /**
     * Applies new bounds and returns any soft warnings about them.
     *
     * @throws InvalidThresholdException if a minimum is not below its maximum; nothing is changed then
     */
    public List<String> update(ThresholdConfig config) {
        List<String> warnings = config.validate();
        if (config.isInverted()) {
            warnings.forEach(w -> log.error("❌ Threshold rejected: {}", w));
            throw new InvalidThresholdException(warnings);
        }

        warnings.forEach(w -> log.warn("⚠️ Threshold Warning: {}", w));
        current.set(config);
        log.info("✅ Thresholds updated - Temp: {}-{}°F, Humidity: {}-{}%",
                config.getTempMin(), config.getTempMax(), config.getHumidityMin(), config.getHumidityMax());
        return warnings;
    }
}
