package com.bmsedge.envmonitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertSummaryDTO {
    private String alertType;
    private long count;
    private long criticalCount;
    private long warningCount;
}
