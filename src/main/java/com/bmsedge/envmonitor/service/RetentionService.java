package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.exception.StoreQueryException;
import com.bmsedge.envmonitor.model.TelemetryFields;
import com.bmsedge.envmonitor.repository.TelemetryStoreGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

@Service
@Slf4j
public class RetentionService {

    private final TelemetryStoreGateway gateway;
    private final Clock clock;
    private final int retentionDays;

    public RetentionService(TelemetryStoreGateway gateway,
                            Clock clock,
                            @Value("${telemetry.retention.days:30}") int retentionDays) {
        this.gateway = gateway;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }

    /**
     * Deletes every document, readings and health markers alike, older than {@code ageInDays}.
     *
     * @return number of deleted documents
     * @throws StoreQueryException if the delete fails
     */
    public long purgeOlderThan(int ageInDays) {
        if (ageInDays < 0) {
            throw new IllegalArgumentException("Retention age must not be negative, got " + ageInDays);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(ageInDays));
        long deleted = gateway.deleteWhere(Criteria.where(TelemetryFields.TIMESTAMP).lt(Date.from(cutoff)));
        log.info("🧹 Cleaned up {} old documents (older than {})", deleted, cutoff);
        return deleted;
    }

    public long purgeExpired() {
        try {
            return purgeOlderThan(retentionDays);
        } catch (StoreQueryException e) {
            log.error("❌ Error cleaning up old data: {}", e.getMessage());
            return 0;
        }
    }

    public int getRetentionDays() {
        return retentionDays;
    }
}
