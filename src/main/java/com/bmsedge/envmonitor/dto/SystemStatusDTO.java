package com.bmsedge.envmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemStatusDTO {
    private boolean storeInitialized;
    private boolean databaseConnected;
    private boolean collectionReady;
    private String collectionName;
    private List<String> indexes;
    private Map<String, Object> sensorConfig;
    private ThresholdConfigDTO alertThresholds;
    private boolean ingestionEnabled;
    private long dataCollectionIntervalMs;
    private Instant lastHealthCheck;
}
