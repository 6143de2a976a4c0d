package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.model.AlertType;
import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorSimulatorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final SensorMetadata METADATA = SensorMetadata.builder()
            .location("MCW").building("CBE").room("ServerRoom").sensorId("SR001").sensorType("environmental")
            .build();

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void neverLeavesSafeRangeWithZeroProbability() {
        SensorSimulator simulator = simulator(0.0);

        for (int i = 0; i < 500; i++) {
            SensorReading reading = simulator.generateReading();
            assertThat(reading.getMetrics().getTemperature()).hasValueSatisfying(t -> assertThat(t).isBetween(65.0, 75.0));
            assertThat(reading.getMetrics().getHumidity()).hasValueSatisfying(h -> assertThat(h).isBetween(45.0, 55.0));
        }
    }

    @Test
    void alwaysLandsThreeToTenOutsideWithFullProbability() {
        SensorSimulator simulator = simulator(1.0);

        for (int i = 0; i < 500; i++) {
            double t = simulator.generateReading().getMetrics().getTemperature().orElseThrow();
            boolean below = t >= 55.0 && t <= 62.0;
            boolean above = t >= 78.0 && t <= 85.0;
            assertThat(below || above).as("temperature %s", t).isTrue();
        }
    }

    @Test
    void valuesAreRoundedToTwoDecimals() {
        SensorReading reading = simulator(0.1).generateReading();

        double t = reading.getMetrics().getTemperature().orElseThrow();
        assertThat(Math.round(t * 100.0) / 100.0).isEqualTo(t);
    }

    @Test
    void readingCarriesMetadataAndClockTime() {
        SensorReading reading = simulator(0.0).generateReading();

        assertThat(reading.getTimestamp()).isEqualTo(NOW);
        assertThat(reading.getMetadata()).isEqualTo(METADATA);
        assertThat(reading.getAlerts()).isEmpty();
    }

    @Test
    void healthStatusIsOptimalWithInfoAlert() {
        HealthStatus status = simulator(0.0).generateHealthStatus();

        assertThat(status.getStatus()).isEqualTo(HealthStatus.STATUS_OPTIMAL);
        assertThat(status.getMetadata().getSensorType()).isEqualTo(HealthStatus.SENSOR_TYPE);
        assertThat(status.getMetadata().getLocation()).isEqualTo("MCW");
        assertThat(status.getAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.getType()).isEqualTo(AlertType.HEALTH_STATUS));
    }

    @Test
    void invertedSafeRangeIsRejected() {
        assertThatThrownBy(() -> new SensorSimulator(clock, new Random(1), new ThresholdEvaluator(), METADATA,
                75, 65, 45, 55, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private SensorSimulator simulator(double outOfRangeProbability) {
        return new SensorSimulator(clock, new Random(42), new ThresholdEvaluator(), METADATA,
                65, 75, 45, 55, outOfRangeProbability);
    }
}
