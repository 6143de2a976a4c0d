package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.dto.AggregatedMetricsDTO;
import com.bmsedge.envmonitor.dto.AlertSummaryDTO;
import com.bmsedge.envmonitor.dto.CollectionStatsDTO;
import com.bmsedge.envmonitor.dto.DataQualityDTO;
import com.bmsedge.envmonitor.dto.TrendBucketDTO;
import com.bmsedge.envmonitor.exception.StoreQueryException;
import com.bmsedge.envmonitor.model.Metric;
import com.bmsedge.envmonitor.model.QueryWindow;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.bmsedge.envmonitor.repository.TelemetryStoreGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bmsedge.envmonitor.model.TelemetryFields.ALERT_TYPE;
import static com.bmsedge.envmonitor.model.TelemetryFields.HUMIDITY;
import static com.bmsedge.envmonitor.model.TelemetryFields.METRICS;
import static com.bmsedge.envmonitor.model.TelemetryFields.SEVERITY;
import static com.bmsedge.envmonitor.model.TelemetryFields.TEMPERATURE;
import static com.bmsedge.envmonitor.model.TelemetryFields.TIMESTAMP;

/**
 * Read side of the telemetry store: filtered listings, alert statistics, hourly trends and quality estimates.
 * <p>
 * A failing store call never surfaces to callers. It is logged and the operation returns an empty
 * list or {@link Optional#empty()}; partial results are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryQueryService {

    public static final int DEFAULT_SEARCH_LIMIT = 100;
    public static final int DEFAULT_RANGE_LIMIT = 1000;

    // Fixed canonical band for optimal periods, independent of the configured thresholds
    static final double OPTIMAL_TEMP_MIN = 63;
    static final double OPTIMAL_TEMP_MAX = 80;
    static final double OPTIMAL_HUMIDITY_MIN = 40;
    static final double OPTIMAL_HUMIDITY_MAX = 60;

    // Sanity band for anomaly counting
    static final double ANOMALY_TEMP_LOW = 60;
    static final double ANOMALY_TEMP_HIGH = 85;
    static final double ANOMALY_HUMIDITY_LOW = 35;
    static final double ANOMALY_HUMIDITY_HIGH = 70;

    static final long READINGS_PER_DAY = 24 * 60;

    private final TelemetryStoreGateway gateway;
    private final Clock clock;

    // ==================== LISTINGS ====================

    /**
     * Documents in the window, newest first.
     */
    public List<TelemetryDocument> recent(QueryWindow window) {
        try {
            Query query = new Query(window.toCriteria()).with(Sort.by(Sort.Direction.DESC, TIMESTAMP));
            List<TelemetryDocument> results = gateway.find(query);
            log.info("✅ Retrieved {} documents for {}", results.size(), window);
            return results;
        } catch (StoreQueryException e) {
            log.error("❌ Error querying recent data: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    public List<TelemetryDocument> recent(int hours, String location, String building, String room) {
        return recent(QueryWindow.lastHours(hours, clock).location(location).building(building).room(room));
    }

    /**
     * Alert-free readings inside the canonical optimal band, newest first.
     */
    public List<TelemetryDocument> optimalPeriods(QueryWindow window) {
        try {
            Criteria criteria = window.toCriteria();
            criteria.and(ALERT_TYPE).is(null);
            criteria.and(TEMPERATURE).gte(OPTIMAL_TEMP_MIN).lte(OPTIMAL_TEMP_MAX);
            criteria.and(HUMIDITY).gte(OPTIMAL_HUMIDITY_MIN).lte(OPTIMAL_HUMIDITY_MAX);

            List<TelemetryDocument> results = gateway.find(
                    new Query(criteria).with(Sort.by(Sort.Direction.DESC, TIMESTAMP)));
            log.info("✅ Retrieved {} optimal condition records", results.size());
            return results;
        } catch (StoreQueryException e) {
            log.error("❌ Error getting optimal periods: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Metadata search over all time, newest first. Time bounds of the window, if any, also apply.
     */
    public List<TelemetryDocument> searchByMetadata(QueryWindow filters, int limit) {
        requirePositiveLimit(limit);
        try {
            Query query = new Query(filters.toCriteria())
                    .with(Sort.by(Sort.Direction.DESC, TIMESTAMP))
                    .limit(limit);
            List<TelemetryDocument> results = gateway.find(query);
            log.info("✅ Metadata search returned {} documents", results.size());
            return results;
        } catch (StoreQueryException e) {
            log.error("❌ Error searching by metadata: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Documents between {@code start} and {@code end}, oldest first.
     */
    public List<TelemetryDocument> timeRange(Instant start, Instant end, int limit) {
        requirePositiveLimit(limit);
        QueryWindow window = QueryWindow.between(start, end);
        try {
            Query query = new Query(window.toCriteria())
                    .with(Sort.by(Sort.Direction.ASC, TIMESTAMP))
                    .limit(limit);
            List<TelemetryDocument> results = gateway.find(query);
            log.info("✅ Retrieved {} documents from {} to {}", results.size(), start, end);
            return results;
        } catch (StoreQueryException e) {
            log.error("❌ Error getting time range data: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    // ==================== AGGREGATIONS ====================

    /**
     * Per alert type counts. Each alert of a document counts once under its own type.
     */
    public List<AlertSummaryDTO> alertSummary(QueryWindow window) {
        Document match = window.toMatchDocument()
                .append(ALERT_TYPE, new Document("$nin", Arrays.asList(null, Collections.emptyList())));

        List<Document> pipeline = List.of(
                new Document("$match", match),
                new Document("$project", new Document()
                        .append("types", asArray("$" + ALERT_TYPE))
                        .append("severities", asArray("$" + SEVERITY))),
                new Document("$project", new Document("pair", new Document("$zip", new Document()
                        .append("inputs", List.of("$types", "$severities"))
                        .append("useLongestLength", true)))),
                new Document("$unwind", "$pair"),
                new Document("$group", new Document("_id", new Document("$arrayElemAt", List.of("$pair", 0)))
                        .append("count", new Document("$sum", 1))
                        .append("criticalCount", countSeverity("CRITICAL"))
                        .append("warningCount", countSeverity("WARNING"))),
                new Document("$sort", new Document("_id", 1)));

        try {
            List<AlertSummaryDTO> summary = gateway.runAggregation(pipeline).stream()
                    .map(doc -> AlertSummaryDTO.builder()
                            .alertType(String.valueOf(doc.get("_id")))
                            .count(asLong(doc.get("count")))
                            .criticalCount(asLong(doc.get("criticalCount")))
                            .warningCount(asLong(doc.get("warningCount")))
                            .build())
                    .collect(Collectors.toList());
            log.info("✅ Alert summary retrieved: {} alert types", summary.size());
            return summary;
        } catch (StoreQueryException e) {
            log.error("❌ Error getting alert summary: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Hourly statistics of one metric, in UTC, oldest bucket first.
     */
    public List<TrendBucketDTO> trend(Metric metric, QueryWindow window) {
        String field = "$" + metric.getField();
        Document match = window.toMatchDocument()
                .append(metric.getField(), new Document("$exists", true).append("$ne", null));

        List<Document> pipeline = List.of(
                new Document("$match", match),
                new Document("$group", new Document("_id", new Document()
                        .append("year", new Document("$year", "$" + TIMESTAMP))
                        .append("month", new Document("$month", "$" + TIMESTAMP))
                        .append("day", new Document("$dayOfMonth", "$" + TIMESTAMP))
                        .append("hour", new Document("$hour", "$" + TIMESTAMP)))
                        .append("avg", new Document("$avg", field))
                        .append("min", new Document("$min", field))
                        .append("max", new Document("$max", field))
                        .append("count", new Document("$sum", 1))),
                new Document("$sort", new Document("_id.year", 1)
                        .append("_id.month", 1)
                        .append("_id.day", 1)
                        .append("_id.hour", 1)));

        try {
            List<TrendBucketDTO> buckets = gateway.runAggregation(pipeline).stream()
                    .map(TelemetryQueryService::toTrendBucket)
                    .collect(Collectors.toList());
            log.info("✅ {} trends retrieved: {} hourly buckets", metric, buckets.size());
            return buckets;
        } catch (StoreQueryException e) {
            log.error("❌ Error getting {} trends: {}", metric, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Window-wide statistics. Empty when no document matches.
     */
    public Optional<AggregatedMetricsDTO> aggregatedMetrics(QueryWindow window) {
        List<Document> pipeline = List.of(
                new Document("$match", window.toMatchDocument()),
                new Document("$group", new Document("_id", null)
                        .append("avgTemperature", new Document("$avg", "$" + TEMPERATURE))
                        .append("minTemperature", new Document("$min", "$" + TEMPERATURE))
                        .append("maxTemperature", new Document("$max", "$" + TEMPERATURE))
                        .append("avgHumidity", new Document("$avg", "$" + HUMIDITY))
                        .append("minHumidity", new Document("$min", "$" + HUMIDITY))
                        .append("maxHumidity", new Document("$max", "$" + HUMIDITY))
                        .append("totalReadings", new Document("$sum", 1))
                        .append("alertCount", new Document("$sum", new Document("$cond", Arrays.asList(
                                new Document("$ifNull", Arrays.asList("$" + ALERT_TYPE, false)), 1, 0))))));

        try {
            List<Document> results = gateway.runAggregation(pipeline);
            if (results.isEmpty()) {
                log.warn("⚠️ No data found for aggregation");
                return Optional.empty();
            }

            Document doc = results.get(0);
            log.info("✅ Aggregated metrics calculated successfully!");
            return Optional.of(AggregatedMetricsDTO.builder()
                    .avgTemperature(asDouble(doc.get("avgTemperature")))
                    .minTemperature(asDouble(doc.get("minTemperature")))
                    .maxTemperature(asDouble(doc.get("maxTemperature")))
                    .avgHumidity(asDouble(doc.get("avgHumidity")))
                    .minHumidity(asDouble(doc.get("minHumidity")))
                    .maxHumidity(asDouble(doc.get("maxHumidity")))
                    .totalReadings(asLong(doc.get("totalReadings")))
                    .alertCount(asLong(doc.get("alertCount")))
                    .build());
        } catch (StoreQueryException e) {
            log.error("❌ Error calculating aggregated metrics: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Completeness estimate over the last {@code days}, assuming one reading per minute.
     */
    public Optional<DataQualityDTO> dataQuality(int days) {
        QueryWindow window = QueryWindow.lastDays(days, clock);
        long expected = days * READINGS_PER_DAY;

        try {
            Criteria metricBearing = window.toCriteria();
            metricBearing.and(METRICS).exists(true);
            long actual = gateway.count(new Query(metricBearing));

            Criteria anomalous = window.toCriteria().orOperator(
                    Criteria.where(TEMPERATURE).lt(ANOMALY_TEMP_LOW),
                    Criteria.where(TEMPERATURE).gt(ANOMALY_TEMP_HIGH),
                    Criteria.where(HUMIDITY).lt(ANOMALY_HUMIDITY_LOW),
                    Criteria.where(HUMIDITY).gt(ANOMALY_HUMIDITY_HIGH));
            long anomalies = gateway.count(new Query(anomalous));

            DataQualityDTO quality = DataQualityDTO.builder()
                    .periodDays(days)
                    .expectedReadings(expected)
                    .actualReadings(actual)
                    .missingReadings(expected - actual)
                    .missingPercentage(round2((expected - actual) * 100.0 / expected))
                    .anomalyCount(anomalies)
                    .completenessPercentage(round2(actual * 100.0 / expected))
                    .build();
            log.info("✅ Data quality metrics calculated successfully!");
            return Optional.of(quality);
        } catch (StoreQueryException e) {
            log.error("❌ Error calculating data quality metrics: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First and last timestamp plus document count of the whole collection. Empty when it holds nothing.
     */
    public Optional<CollectionStatsDTO> collectionStats() {
        List<Document> pipeline = List.of(
                new Document("$group", new Document("_id", null)
                        .append("firstRecord", new Document("$min", "$" + TIMESTAMP))
                        .append("lastRecord", new Document("$max", "$" + TIMESTAMP))
                        .append("totalDocuments", new Document("$sum", 1))));

        try {
            List<Document> results = gateway.runAggregation(pipeline);
            if (results.isEmpty()) {
                return Optional.empty();
            }
            Document doc = results.get(0);
            return Optional.of(CollectionStatsDTO.builder()
                    .firstRecord(asInstant(doc.get("firstRecord")))
                    .lastRecord(asInstant(doc.get("lastRecord")))
                    .totalDocuments(asLong(doc.get("totalDocuments")))
                    .build());
        } catch (StoreQueryException e) {
            log.error("❌ Error getting collection stats: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== HELPERS ====================

    private static Document asArray(String fieldRef) {
        return new Document("$cond", Arrays.asList(
                new Document("$isArray", fieldRef), fieldRef, List.of(fieldRef)));
    }

    private static Document countSeverity(String severity) {
        return new Document("$sum", new Document("$cond", Arrays.asList(
                new Document("$eq", Arrays.asList(new Document("$arrayElemAt", Arrays.asList("$pair", 1)), severity)),
                1, 0)));
    }

    private static TrendBucketDTO toTrendBucket(Document doc) {
        Document id = doc.get("_id", Document.class);
        int year = ((Number) id.get("year")).intValue();
        int month = ((Number) id.get("month")).intValue();
        int day = ((Number) id.get("day")).intValue();
        int hour = ((Number) id.get("hour")).intValue();

        return TrendBucketDTO.builder()
                .bucketStart(LocalDateTime.of(year, month, day, hour, 0).toInstant(ZoneOffset.UTC))
                .year(year)
                .month(month)
                .day(day)
                .hour(hour)
                .avg(((Number) doc.get("avg")).doubleValue())
                .min(((Number) doc.get("min")).doubleValue())
                .max(((Number) doc.get("max")).doubleValue())
                .count(asLong(doc.get("count")))
                .build();
    }

    private static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Instant asInstant(Object value) {
        return value instanceof Date date ? date.toInstant() : null;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static void requirePositiveLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
    }
}
