package com.bmsedge.envmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Statistics of one metric over one UTC hour.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrendBucketDTO {
    private Instant bucketStart;
    private int year;
    private int month;
    private int day;
    private int hour;
    private double avg;
    private double min;
    private double max;
    private long count;
}
