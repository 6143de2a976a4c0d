package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.dto.TelemetryDocumentDTO;
import com.bmsedge.envmonitor.model.Alert;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reports alerts: to the log at a level matching their severity, and to WebSocket subscribers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertPublisher {

    public static final String ALERT_TOPIC = "/topic/alerts";

    private final SimpMessagingTemplate messagingTemplate;

    public void logAlerts(List<Alert> alerts) {
        for (Alert alert : alerts) {
            switch (alert.getSeverity()) {
                case CRITICAL -> log.error("🚨 CRITICAL ALERT: {}", alert.getMessage());
                case WARNING -> log.warn("⚠️ WARNING: {}", alert.getMessage());
                default -> log.info("ℹ️ INFO: {}", alert.getMessage());
            }
        }
    }

    public String summarize(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return "No alerts generated";
        }

        StringBuilder summary = new StringBuilder("Generated ").append(alerts.size()).append(" alerts:\n");
        for (Alert alert : alerts) {
            summary.append("  - ")
                    .append(alert.getSeverity()).append(": ")
                    .append(alert.getType()).append(" - ")
                    .append(alert.getMessage()).append('\n');
        }
        return summary.toString();
    }

    /**
     * Pushes a stored document to {@value #ALERT_TOPIC}. Alerts are expected to be logged
     * already by {@link #logAlerts(List)}. Documents without alerts are not broadcast.
     * A failed broadcast is only logged.
     */
    public void publish(TelemetryDocument document) {
        if (!document.hasAlerts()) {
            return;
        }

        try {
            messagingTemplate.convertAndSend(ALERT_TOPIC, TelemetryDocumentDTO.from(document));
            log.debug("📡 Broadcast {} alerts to {}", document.getAlerts().size(), ALERT_TOPIC);
        } catch (Exception e) {
            log.error("❌ Error broadcasting alerts to {}: {}", ALERT_TOPIC, e.getMessage());
        }
    }
}
