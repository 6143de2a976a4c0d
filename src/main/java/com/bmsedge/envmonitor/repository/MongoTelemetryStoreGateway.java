package com.bmsedge.envmonitor.repository;

import com.bmsedge.envmonitor.exception.StoreQueryException;
import com.bmsedge.envmonitor.exception.StoreWriteException;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.bmsedge.envmonitor.model.TelemetryFields;
import com.mongodb.MongoException;
import com.mongodb.client.result.DeleteResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class MongoTelemetryStoreGateway implements TelemetryStoreGateway {

    private final MongoTemplate mongoTemplate;
    private final TelemetryDocumentMapper mapper;
    private final String collectionName;

    public MongoTelemetryStoreGateway(MongoTemplate mongoTemplate,
                                      TelemetryDocumentMapper mapper,
                                      @Value("${telemetry.collection:serverRoomLogs}") String collectionName) {
        this.mongoTemplate = mongoTemplate;
        this.mapper = mapper;
        this.collectionName = collectionName;
    }

    @Override
    public String insert(TelemetryDocument document) {
        Document doc = mapper.toDocument(document);
        try {
            Document saved = mongoTemplate.insert(doc, collectionName);
            Object id = saved.get(TelemetryFields.ID);
            if (id == null) {
                throw new StoreWriteException("Insert into " + collectionName + " returned no id", null);
            }
            return id instanceof ObjectId objectId ? objectId.toHexString() : id.toString();
        } catch (DataAccessException | MongoException e) {
            throw new StoreWriteException("Failed to insert document into " + collectionName, e);
        }
    }

    @Override
    public Optional<TelemetryDocument> findById(String id) {
        try {
            Query query = Query.query(Criteria.where(TelemetryFields.ID).is(mapper.toObjectId(id)));
            Document found = mongoTemplate.findOne(query, Document.class, collectionName);
            return Optional.ofNullable(found).map(mapper::fromDocument);
        } catch (DataAccessException | MongoException e) {
            throw new StoreQueryException("Failed to look up document " + id, e);
        }
    }

    @Override
    public long deleteWhere(Criteria predicate) {
        try {
            DeleteResult result = mongoTemplate.remove(Query.query(predicate), collectionName);
            return result.getDeletedCount();
        } catch (DataAccessException | MongoException e) {
            throw new StoreQueryException("Failed to delete documents from " + collectionName, e);
        }
    }

    @Override
    public List<Document> runAggregation(List<Document> pipeline) {
        List<AggregationOperation> stages = pipeline.stream()
                .map(MongoTelemetryStoreGateway::rawStage)
                .collect(Collectors.toList());
        try {
            return mongoTemplate.aggregate(Aggregation.newAggregation(stages), collectionName, Document.class)
                    .getMappedResults();
        } catch (DataAccessException | MongoException e) {
            throw new StoreQueryException("Aggregation on " + collectionName + " failed", e);
        }
    }

    @Override
    public List<TelemetryDocument> find(Query query) {
        try {
            return mongoTemplate.find(query, Document.class, collectionName).stream()
                    .map(mapper::fromDocument)
                    .collect(Collectors.toList());
        } catch (DataAccessException | MongoException e) {
            throw new StoreQueryException("Query on " + collectionName + " failed", e);
        }
    }

    @Override
    public long count(Query query) {
        try {
            return mongoTemplate.count(query, collectionName);
        } catch (DataAccessException | MongoException e) {
            throw new StoreQueryException("Count on " + collectionName + " failed", e);
        }
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    private static AggregationOperation rawStage(Document stage) {
        return context -> stage;
    }
}
