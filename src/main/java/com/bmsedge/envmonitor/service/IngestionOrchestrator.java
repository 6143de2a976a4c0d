package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.exception.StoreWriteException;
import com.bmsedge.envmonitor.exception.TelemetryStoreException;
import com.bmsedge.envmonitor.exception.VerificationMismatchException;
import com.bmsedge.envmonitor.model.Alert;
import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.Metric;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.SensorReading;
import com.bmsedge.envmonitor.repository.TelemetryStoreGateway;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the ingestion loop: generate, evaluate, store and verify one reading per tick,
 * plus a slower maintenance task that writes a health marker and purges expired data.
 * <p>
 * Ticks, maintenance and shutdown are serialized by one lock, so a shutdown waits for an
 * in-flight insert. A failing tick is logged and never affects the next one.
 */
@Service
@DependsOn("telemetryStoreInitializer")
@Slf4j
public class IngestionOrchestrator {

    public enum CycleOutcome {
        STORED,
        WRITE_FAILED,
        VERIFICATION_FAILED,
        FAILED,
        SKIPPED
    }

    private final SensorSimulator sensorSimulator;
    private final ThresholdEvaluator evaluator;
    private final ThresholdService thresholdService;
    private final AlertPublisher alertPublisher;
    private final TelemetryStoreGateway gateway;
    private final RetentionService retentionService;
    private final Clock clock;
    private final boolean enabled;
    private final long intervalMs;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean stopped;
    private volatile Instant lastHealthCheck;

    public IngestionOrchestrator(SensorSimulator sensorSimulator,
                                 ThresholdEvaluator evaluator,
                                 ThresholdService thresholdService,
                                 AlertPublisher alertPublisher,
                                 TelemetryStoreGateway gateway,
                                 RetentionService retentionService,
                                 Clock clock,
                                 @Value("${telemetry.ingestion.enabled:true}") boolean enabled,
                                 @Value("${telemetry.ingestion.interval-ms:60000}") long intervalMs) {
        this.sensorSimulator = sensorSimulator;
        this.evaluator = evaluator;
        this.thresholdService = thresholdService;
        this.alertPublisher = alertPublisher;
        this.gateway = gateway;
        this.retentionService = retentionService;
        this.clock = clock;
        this.enabled = enabled;
        this.intervalMs = intervalMs;
    }

    @Scheduled(fixedDelayString = "${telemetry.ingestion.interval-ms:60000}")
    public void scheduledCycle() {
        runCycle();
    }

    @Scheduled(fixedDelayString = "${telemetry.health.interval-ms:86400000}")
    public void scheduledHealthMaintenance() {
        runHealthMaintenance();
    }

    public CycleOutcome runCycle() {
        if (!enabled || stopped) {
            return CycleOutcome.SKIPPED;
        }

        lock.lock();
        try {
            if (stopped) {
                return CycleOutcome.SKIPPED;
            }
            return ingestOneReading();
        } catch (Exception e) {
            log.error("❌ Error in simulation cycle: {}", e.getMessage(), e);
            return CycleOutcome.FAILED;
        } finally {
            lock.unlock();
        }
    }

    private CycleOutcome ingestOneReading() {
        SensorReading generated = sensorSimulator.generateReading();
        List<Alert> alerts = evaluator.evaluate(generated.getMetrics(), thresholdService.current());
        SensorReading reading = generated.withAlerts(alerts);
        alertPublisher.logAlerts(alerts);

        String id;
        try {
            id = gateway.insert(reading);
        } catch (StoreWriteException e) {
            log.error("❌ Failed to insert sensor data: {}", e.getMessage());
            return CycleOutcome.WRITE_FAILED;
        }

        try {
            verify(id);
        } catch (VerificationMismatchException e) {
            log.error("❌ Data insertion verification failed: document {} not found after insert", e.getDocumentId());
            return CycleOutcome.VERIFICATION_FAILED;
        }

        // Only stored readings reach subscribers
        alertPublisher.publish(reading);

        String temperature = format(reading.getMetrics(), Metric.TEMPERATURE);
        String humidity = format(reading.getMetrics(), Metric.HUMIDITY);
        if (alerts.isEmpty()) {
            log.info("[{}] Temp: {}, Humidity: {}", reading.getTimestamp(), temperature, humidity);
        } else {
            log.info("[{}] Temp: {}, Humidity: {} - {}",
                    reading.getTimestamp(), temperature, humidity, alertPublisher.summarize(alerts));
        }
        return CycleOutcome.STORED;
    }

    private static String format(Metrics metrics, Metric metric) {
        return metrics.get(metric).map(value -> value + metric.getUnit()).orElse("-");
    }

    private void verify(String id) {
        Optional<?> stored = gateway.findById(id);
        if (stored.isEmpty()) {
            throw new VerificationMismatchException(id);
        }
    }

    /**
     * Writes a health marker and purges data past the retention period.
     */
    public void runHealthMaintenance() {
        if (!enabled || stopped) {
            return;
        }

        lock.lock();
        try {
            if (stopped) {
                return;
            }
            log.info("Running health maintenance tasks...");

            HealthStatus status = sensorSimulator.generateHealthStatus();
            try {
                gateway.insert(status);
            } catch (TelemetryStoreException e) {
                log.error("❌ Failed to insert health status: {}", e.getMessage());
            }

            long cleaned = retentionService.purgeExpired();
            log.info("Data cleanup completed: {} old documents removed", cleaned);

            lastHealthCheck = clock.instant();
            log.info("✅ Health maintenance completed successfully");
        } catch (Exception e) {
            log.error("❌ Error in health maintenance: {}", e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping ingestion...");
        stopped = true;
        lock.lock();
        try {
            log.info("✅ Ingestion stopped");
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isStopped() {
        return stopped;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public Optional<Instant> getLastHealthCheck() {
        return Optional.ofNullable(lastHealthCheck);
    }
}
