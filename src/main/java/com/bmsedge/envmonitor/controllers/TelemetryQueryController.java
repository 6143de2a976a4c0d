package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.dto.AggregatedMetricsDTO;
import com.bmsedge.envmonitor.dto.AlertSummaryDTO;
import com.bmsedge.envmonitor.dto.CollectionStatsDTO;
import com.bmsedge.envmonitor.dto.DataQualityDTO;
import com.bmsedge.envmonitor.dto.TelemetryDocumentDTO;
import com.bmsedge.envmonitor.dto.TrendBucketDTO;
import com.bmsedge.envmonitor.model.Metric;
import com.bmsedge.envmonitor.model.QueryWindow;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.bmsedge.envmonitor.service.TelemetryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class TelemetryQueryController {

    private final TelemetryQueryService queryService;
    private final Clock clock;

    // Readings of the last N hours, newest first
    @GetMapping("/recent")
    public ResponseEntity<List<TelemetryDocumentDTO>> getRecent(
            @RequestParam(defaultValue = "24") int hours,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String building,
            @RequestParam(required = false) String room) {
        return ResponseEntity.ok(toDTOs(queryService.recent(hours, location, building, room)));
    }

    @GetMapping("/alerts/summary")
    public ResponseEntity<List<AlertSummaryDTO>> getAlertSummary(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(queryService.alertSummary(QueryWindow.lastDays(days, clock)));
    }

    // Hourly buckets for temperature or humidity
    @GetMapping("/trends/{metric}")
    public ResponseEntity<List<TrendBucketDTO>> getTrend(
            @PathVariable String metric,
            @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(queryService.trend(Metric.fromName(metric), QueryWindow.lastDays(days, clock)));
    }

    @GetMapping("/optimal")
    public ResponseEntity<List<TelemetryDocumentDTO>> getOptimalPeriods(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(toDTOs(queryService.optimalPeriods(QueryWindow.lastDays(days, clock))));
    }

    @GetMapping("/aggregate")
    public ResponseEntity<?> getAggregatedMetrics(
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String building,
            @RequestParam(required = false) String room) {
        QueryWindow window = QueryWindow.between(start, end).location(location).building(building).room(room);
        return queryService.aggregatedMetrics(window)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("message", "No data found for aggregation")));
    }

    @GetMapping("/quality")
    public ResponseEntity<DataQualityDTO> getDataQuality(@RequestParam(defaultValue = "7") int days) {
        return queryService.dataQuality(days)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @GetMapping("/search")
    public ResponseEntity<List<TelemetryDocumentDTO>> search(
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String building,
            @RequestParam(required = false) String room,
            @RequestParam(required = false) String sensorId,
            @RequestParam(defaultValue = "" + TelemetryQueryService.DEFAULT_SEARCH_LIMIT) int limit) {
        QueryWindow filters = QueryWindow.allTime().location(location).building(building).room(room).sensorId(sensorId);
        return ResponseEntity.ok(toDTOs(queryService.searchByMetadata(filters, limit)));
    }

    // Oldest first
    @GetMapping("/range")
    public ResponseEntity<List<TelemetryDocumentDTO>> getTimeRange(
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(defaultValue = "" + TelemetryQueryService.DEFAULT_RANGE_LIMIT) int limit) {
        return ResponseEntity.ok(toDTOs(queryService.timeRange(start, end, limit)));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getCollectionStats() {
        return queryService.collectionStats()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(CollectionStatsDTO.builder().totalDocuments(0).build()));
    }

    private static List<TelemetryDocumentDTO> toDTOs(List<TelemetryDocument> documents) {
        return documents.stream().map(TelemetryDocumentDTO::from).collect(Collectors.toList());
    }
}
