package com.bmsedge.envmonitor.dto;

import com.bmsedge.envmonitor.model.Alert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertDTO {
    private String type;
    private String message;
    private String severity;

    public static AlertDTO from(Alert alert) {
        return AlertDTO.builder()
                .type(alert.getType().name())
                .message(alert.getMessage())
                .severity(alert.getSeverity().name())
                .build();
    }
}
