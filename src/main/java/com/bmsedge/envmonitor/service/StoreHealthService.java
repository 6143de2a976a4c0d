package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.exception.StoreConnectionException;
import com.mongodb.MongoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Date;

/**
 * Connectivity checks against the database.
 * <p>
 * The round-trip check runs on a plain scratch collection, never on the telemetry collection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreHealthService {

    static final String HEALTH_COLLECTION = "__health";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    /**
     * @throws StoreConnectionException if the server does not answer
     */
    public void ping() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            log.info("✅ Connected to MongoDB database '{}'", mongoTemplate.getDb().getName());
        } catch (DataAccessException | MongoException e) {
            log.error("❌ Failed to connect to MongoDB: {}", e.getMessage());
            throw new StoreConnectionException("MongoDB ping failed", e);
        }
    }

    /**
     * Inserts, reads back and deletes one scratch document.
     *
     * @throws StoreConnectionException if any step fails
     */
    public void checkHealth() {
        try {
            Document marker = new Document("test", "health_check").append("timestamp", Date.from(clock.instant()));
            Document saved = mongoTemplate.insert(marker, HEALTH_COLLECTION);
            Query byId = Query.query(Criteria.where("_id").is(saved.get("_id")));

            if (mongoTemplate.findOne(byId, Document.class, HEALTH_COLLECTION) == null) {
                throw new StoreConnectionException("Health check document could not be read back", null);
            }
            mongoTemplate.remove(byId, HEALTH_COLLECTION);
            log.info("✅ Database health check passed");
        } catch (DataAccessException | MongoException e) {
            log.error("❌ Database health check failed: {}", e.getMessage());
            throw new StoreConnectionException("Database health check failed", e);
        }
    }

    public boolean isConnected() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            return true;
        } catch (DataAccessException | MongoException e) {
            log.warn("⚠️ MongoDB not reachable: {}", e.getMessage());
            return false;
        }
    }
}
