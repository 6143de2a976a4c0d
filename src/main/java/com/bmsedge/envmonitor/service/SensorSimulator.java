package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Generates temperature and humidity readings for one configured sensor.
 * <p>
 * Values are mostly inside the safe range. With the configured probability a value
 * lands 3 to 10 units below or above it instead, so alerts get exercised.
 */
@Component
@Slf4j
public class SensorSimulator {

    private final Clock clock;
    private final Random random;
    private final ThresholdEvaluator evaluator;

    private final SensorMetadata metadata;
    private final double tempSafeMin;
    private final double tempSafeMax;
    private final double humiditySafeMin;
    private final double humiditySafeMax;
    private final double outOfRangeProbability;

    @Autowired
    public SensorSimulator(Clock clock,
                           ThresholdEvaluator evaluator,
                           @Value("${telemetry.sensor.location:MCW}") String location,
                           @Value("${telemetry.sensor.building:CBE}") String building,
                           @Value("${telemetry.sensor.room:ServerRoom}") String room,
                           @Value("${telemetry.sensor.id:SR001}") String sensorId,
                           @Value("${telemetry.sensor.type:environmental}") String sensorType,
                           @Value("${telemetry.simulator.temp-safe-min:65}") double tempSafeMin,
                           @Value("${telemetry.simulator.temp-safe-max:75}") double tempSafeMax,
                           @Value("${telemetry.simulator.humidity-safe-min:45}") double humiditySafeMin,
                           @Value("${telemetry.simulator.humidity-safe-max:55}") double humiditySafeMax,
                           @Value("${telemetry.simulator.out-of-range-probability:0.1}") double outOfRangeProbability) {
        this(clock, new Random(), evaluator,
                SensorMetadata.builder()
                        .location(location)
                        .building(building)
                        .room(room)
                        .sensorId(sensorId)
                        .sensorType(sensorType)
                        .build(),
                tempSafeMin, tempSafeMax, humiditySafeMin, humiditySafeMax, outOfRangeProbability);
    }

    SensorSimulator(Clock clock, Random random, ThresholdEvaluator evaluator, SensorMetadata metadata,
                    double tempSafeMin, double tempSafeMax,
                    double humiditySafeMin, double humiditySafeMax,
                    double outOfRangeProbability) {
        if (tempSafeMin > tempSafeMax || humiditySafeMin > humiditySafeMax) {
            throw new IllegalArgumentException("Safe range minimum must not exceed maximum");
        }
        this.clock = clock;
        this.random = random;
        this.evaluator = evaluator;
        this.metadata = metadata;
        this.tempSafeMin = tempSafeMin;
        this.tempSafeMax = tempSafeMax;
        this.humiditySafeMin = humiditySafeMin;
        this.humiditySafeMax = humiditySafeMax;
        this.outOfRangeProbability = Math.max(0.0, Math.min(1.0, outOfRangeProbability));
    }

    /**
     * A fresh reading stamped with the current time. Alerts are not evaluated here.
     */
    public SensorReading generateReading() {
        return SensorReading.builder()
                .timestamp(clock.instant())
                .metadata(metadata)
                .metrics(Metrics.of(
                        generateValue(tempSafeMin, tempSafeMax),
                        generateValue(humiditySafeMin, humiditySafeMax)))
                .build();
    }

    public HealthStatus generateHealthStatus() {
        return HealthStatus.builder()
                .timestamp(clock.instant())
                .metadata(metadata.toBuilder()
                        .sensorId(null)
                        .sensorType(HealthStatus.SENSOR_TYPE)
                        .build())
                .status(HealthStatus.STATUS_OPTIMAL)
                .message(ThresholdEvaluator.HEALTH_STATUS_MESSAGE)
                .alert(evaluator.healthStatusAlert())
                .build();
    }

    public Map<String, Object> getSensorInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("location", metadata.getLocation());
        info.put("building", metadata.getBuilding());
        info.put("room", metadata.getRoom());
        info.put("sensorId", metadata.getSensorId());
        info.put("sensorType", metadata.getSensorType());
        info.put("safeTemperatureRange", new double[]{tempSafeMin, tempSafeMax});
        info.put("safeHumidityRange", new double[]{humiditySafeMin, humiditySafeMax});
        info.put("outOfRangeProbability", outOfRangeProbability);
        return info;
    }

    private double generateValue(double safeMin, double safeMax) {
        double value;
        if (random.nextDouble() >= outOfRangeProbability) {
            value = uniform(safeMin, safeMax);
        } else if (random.nextDouble() < 0.5) {
            value = uniform(safeMin - 10, safeMin - 3);
        } else {
            value = uniform(safeMax + 3, safeMax + 10);
        }
        return Math.round(value * 100.0) / 100.0;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
