package com.bmsedge.envmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DataQualityDTO {
    private int periodDays;
    private long expectedReadings;
    private long actualReadings;
    private long missingReadings;
    private double missingPercentage;
    private long anomalyCount;
    private double completenessPercentage;
}
