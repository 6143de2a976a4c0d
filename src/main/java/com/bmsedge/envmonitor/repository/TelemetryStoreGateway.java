package com.bmsedge.envmonitor.repository;

import com.bmsedge.envmonitor.model.TelemetryDocument;
import org.bson.Document;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Optional;

/**
 * Thin boundary around the telemetry collection.
 * <p>
 * Nothing here retries. Write failures surface as
 * {@link com.bmsedge.envmonitor.exception.StoreWriteException}, everything else as
 * {@link com.bmsedge.envmonitor.exception.StoreQueryException}. Read-after-write
 * visibility is not guaranteed; callers verify inserts with {@link #findById(String)}.
 */
public interface TelemetryStoreGateway {

    /**
     * Inserts the document and returns its new id as a hex string.
     */
    String insert(TelemetryDocument document);

    Optional<TelemetryDocument> findById(String id);

    /**
     * Deletes every document matching the predicate and returns how many were removed.
     */
    long deleteWhere(Criteria predicate);

    List<Document> runAggregation(List<Document> pipeline);

    List<TelemetryDocument> find(Query query);

    long count(Query query);

    String getCollectionName();
}
