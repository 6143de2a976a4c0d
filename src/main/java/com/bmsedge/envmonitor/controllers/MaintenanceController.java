package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.dto.SystemStatusDTO;
import com.bmsedge.envmonitor.dto.ThresholdConfigDTO;
import com.bmsedge.envmonitor.model.QueryWindow;
import com.bmsedge.envmonitor.repository.TimeSeriesSchemaManager;
import com.bmsedge.envmonitor.service.DataExportService;
import com.bmsedge.envmonitor.service.IngestionOrchestrator;
import com.bmsedge.envmonitor.service.RetentionService;
import com.bmsedge.envmonitor.service.SensorSimulator;
import com.bmsedge.envmonitor.service.StoreHealthService;
import com.bmsedge.envmonitor.service.TelemetryStoreInitializer;
import com.bmsedge.envmonitor.service.ThresholdService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
@Slf4j
public class MaintenanceController {

    private final RetentionService retentionService;
    private final DataExportService exportService;
    private final StoreHealthService storeHealthService;
    private final TimeSeriesSchemaManager schemaManager;
    private final SensorSimulator sensorSimulator;
    private final ThresholdService thresholdService;
    private final IngestionOrchestrator orchestrator;
    private final TelemetryStoreInitializer storeInitializer;
    private final Clock clock;

    // Purge documents older than N days, the configured retention period by default
    @PostMapping("/retention")
    public ResponseEntity<Map<String, Object>> purge(@RequestParam(required = false) Integer days) {
        int ageInDays = days != null ? days : retentionService.getRetentionDays();
        long deleted = retentionService.purgeOlderThan(ageInDays);
        return ResponseEntity.ok(Map.<String, Object>of("deleted", deleted, "olderThanDays", ageInDays));
    }

    @PostMapping("/export")
    public ResponseEntity<Map<String, Object>> export(
            @RequestParam(defaultValue = "1") int days,
            @RequestParam(defaultValue = DataExportService.DEFAULT_EXPORT_FILE) String file) {
        Path path = exportService.resolveExportFile(file);
        int exported = exportService.exportToJson(path, QueryWindow.lastDays(days, clock));
        return ResponseEntity.ok(Map.<String, Object>of("exported", exported, "file", path.toString()));
    }

    @GetMapping("/status")
    public ResponseEntity<SystemStatusDTO> getStatus() {
        boolean connected = storeHealthService.isConnected();
        List<String> indexes = Collections.emptyList();
        if (connected) {
            try {
                indexes = schemaManager.listIndexKeys();
            } catch (RuntimeException e) {
                log.warn("⚠️ Could not list indexes: {}", e.getMessage());
            }
        }

        SystemStatusDTO status = SystemStatusDTO.builder()
                .storeInitialized(storeInitializer.isInitialized())
                .databaseConnected(connected)
                .collectionReady(connected && schemaManager.isReady())
                .collectionName(schemaManager.getCollectionName())
                .indexes(indexes)
                .sensorConfig(sensorSimulator.getSensorInfo())
                .alertThresholds(ThresholdConfigDTO.from(thresholdService.current()))
                .ingestionEnabled(orchestrator.isEnabled())
                .dataCollectionIntervalMs(orchestrator.getIntervalMs())
                .lastHealthCheck(orchestrator.getLastHealthCheck().orElse(null))
                .build();
        return ResponseEntity.ok(status);
    }
}
