package com.bmsedge.envmonitor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Bounded timeouts for the shared MongoDB client, so an unreachable server fails fast.
 */
@Configuration
@Slf4j
public class MongoClientConfig {

    @Value("${telemetry.mongo.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${telemetry.mongo.server-selection-timeout-ms:5000}")
    private long serverSelectionTimeoutMs;

    @Value("${telemetry.mongo.socket-timeout-ms:5000}")
    private int socketTimeoutMs;

    @Bean
    public MongoClientSettingsBuilderCustomizer telemetryTimeouts() {
        log.info("MongoDB timeouts - connect: {}ms, server selection: {}ms, socket: {}ms",
                connectTimeoutMs, serverSelectionTimeoutMs, socketTimeoutMs);
        return builder -> builder
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                        .readTimeout(socketTimeoutMs, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS));
    }
}
