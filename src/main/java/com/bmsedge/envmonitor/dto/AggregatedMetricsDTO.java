package com.bmsedge.envmonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a window. Metric statistics are null when no document in the window carried that metric.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregatedMetricsDTO {
    private Double avgTemperature;
    private Double minTemperature;
    private Double maxTemperature;
    private Double avgHumidity;
    private Double minHumidity;
    private Double maxHumidity;
    private long totalReadings;
    private long alertCount;
}
