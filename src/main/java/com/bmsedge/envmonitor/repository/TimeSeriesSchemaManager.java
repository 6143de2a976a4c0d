package com.bmsedge.envmonitor.repository;

import com.bmsedge.envmonitor.exception.SchemaSetupException;
import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.CollectionOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexField;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.timeseries.Granularity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.bmsedge.envmonitor.model.TelemetryFields.ALERT_MESSAGE;
import static com.bmsedge.envmonitor.model.TelemetryFields.ALERT_TYPE;
import static com.bmsedge.envmonitor.model.TelemetryFields.BUILDING;
import static com.bmsedge.envmonitor.model.TelemetryFields.LOCATION;
import static com.bmsedge.envmonitor.model.TelemetryFields.METADATA;
import static com.bmsedge.envmonitor.model.TelemetryFields.ROOM;
import static com.bmsedge.envmonitor.model.TelemetryFields.SEVERITY;
import static com.bmsedge.envmonitor.model.TelemetryFields.TIMESTAMP;

/**
 * Creates the time-series collection and keeps its index set in shape.
 * <p>
 * Alert fields are arrays on some documents and absent on others, so they are never
 * indexed. Indexes on them left over from older schema versions are dropped.
 */
@Component
@Slf4j
public class TimeSeriesSchemaManager {

    private static final Set<String> ALERT_FIELDS = Set.of(ALERT_TYPE, ALERT_MESSAGE, SEVERITY, "alerts");

    private final MongoTemplate mongoTemplate;
    private final String collectionName;

    public TimeSeriesSchemaManager(MongoTemplate mongoTemplate,
                                   @Value("${telemetry.collection:serverRoomLogs}") String collectionName) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = collectionName;
    }

    /**
     * Idempotent: safe to call on every startup and from racing initializers.
     *
     * @throws SchemaSetupException when the collection or an index cannot be created
     */
    public void ensureSchema() {
        try {
            if (mongoTemplate.collectionExists(collectionName)) {
                log.info("Time-series collection '{}' already exists", collectionName);
            } else {
                createTimeSeriesCollection();
            }

            IndexOperations indexOps = mongoTemplate.indexOps(collectionName);
            dropIncompatibleIndexes(indexOps);
            for (Index index : requiredIndexes()) {
                indexOps.ensureIndex(index);
            }
            log.info("✅ Indexes ensured on '{}'", collectionName);
        } catch (SchemaSetupException e) {
            throw e;
        } catch (DataAccessException | MongoException e) {
            log.error("❌ Error setting up time-series collection '{}': {}", collectionName, e.getMessage());
            throw new SchemaSetupException("Schema setup failed for collection " + collectionName, e);
        }
    }

    /**
     * Key specs of the current indexes, e.g. {@code timestamp:-1,metadata.location:1}.
     */
    public List<String> listIndexKeys() {
        return mongoTemplate.indexOps(collectionName).getIndexInfo().stream()
                .map(TimeSeriesSchemaManager::describe)
                .collect(Collectors.toList());
    }

    public boolean isReady() {
        try {
            return mongoTemplate.collectionExists(collectionName);
        } catch (DataAccessException | MongoException e) {
            log.warn("⚠️ Could not check collection '{}': {}", collectionName, e.getMessage());
            return false;
        }
    }

    public String getCollectionName() {
        return collectionName;
    }

    private void createTimeSeriesCollection() {
        log.info("Creating time-series collection '{}'...", collectionName);
        CollectionOptions options = CollectionOptions.empty()
                .timeSeries(CollectionOptions.TimeSeriesOptions.timeSeries(TIMESTAMP)
                        .metaField(METADATA)
                        .granularity(Granularity.MINUTES));
        try {
            mongoTemplate.createCollection(collectionName, options);
            log.info("✅ Time-series collection '{}' created", collectionName);
        } catch (DataAccessException | MongoException e) {
            // Another initializer may have created it between our check and the create call.
            if (mongoTemplate.collectionExists(collectionName)) {
                log.info("Time-series collection '{}' already exists (created concurrently)", collectionName);
                return;
            }
            throw new SchemaSetupException("Could not create time-series collection " + collectionName, e);
        }
    }

    private void dropIncompatibleIndexes(IndexOperations indexOps) {
        for (IndexInfo info : indexOps.getIndexInfo()) {
            boolean touchesAlerts = info.getIndexFields().stream()
                    .map(IndexField::getKey)
                    .anyMatch(TimeSeriesSchemaManager::isAlertField);
            if (!touchesAlerts) {
                continue;
            }
            try {
                indexOps.dropIndex(info.getName());
                log.info("Dropped incompatible index: {}", info.getName());
            } catch (DataAccessException | MongoException e) {
                log.warn("⚠️ Could not drop index {}: {}", info.getName(), e.getMessage());
            }
        }
    }

    static boolean isAlertField(String key) {
        return ALERT_FIELDS.contains(key) || key.startsWith("alerts.");
    }

    static List<Index> requiredIndexes() {
        return List.of(
                new Index().on(TIMESTAMP, Sort.Direction.DESC),
                new Index().on(LOCATION, Sort.Direction.ASC),
                new Index().on(BUILDING, Sort.Direction.ASC),
                new Index().on(ROOM, Sort.Direction.ASC),
                new Index()
                        .on(TIMESTAMP, Sort.Direction.DESC)
                        .on(LOCATION, Sort.Direction.ASC)
                        .on(BUILDING, Sort.Direction.ASC)
        );
    }

    private static String describe(IndexInfo info) {
        return info.getIndexFields().stream()
                .map(field -> field.getKey() + ":" + (field.getDirection() == Sort.Direction.DESC ? -1 : 1))
                .collect(Collectors.joining(","));
    }
}
