package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.repository.TimeSeriesSchemaManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prepares the store before anything reads or writes telemetry.
 * Any failure here aborts application startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelemetryStoreInitializer {

    private final StoreHealthService storeHealthService;
    private final TimeSeriesSchemaManager schemaManager;

    private volatile boolean initialized;

    @PostConstruct
    public void initialize() {
        log.info("Initializing telemetry store...");
        storeHealthService.ping();
        schemaManager.ensureSchema();
        storeHealthService.checkHealth();
        initialized = true;
        log.info("✅ Telemetry store ready - collection '{}'", schemaManager.getCollectionName());
    }

    public boolean isInitialized() {
        return initialized;
    }
}
