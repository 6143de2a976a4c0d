package com.bmsedge.envmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CollectionStatsDTO {
    private Instant firstRecord;
    private Instant lastRecord;
    private long totalDocuments;
}
