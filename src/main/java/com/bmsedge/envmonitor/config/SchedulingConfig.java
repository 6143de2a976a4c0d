package com.bmsedge.envmonitor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the ingestion and maintenance ticks
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "telemetry.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
