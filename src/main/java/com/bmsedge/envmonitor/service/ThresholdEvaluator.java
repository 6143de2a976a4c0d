package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.model.Alert;
import com.bmsedge.envmonitor.model.AlertType;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.Severity;
import com.bmsedge.envmonitor.model.ThresholdConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns metric values into alerts. Stateless; the bounds are passed in on every call.
 */
@Component
public class ThresholdEvaluator {

    /** Distance from the violated bound up to which an alert stays a WARNING. */
    static final double WARNING_MARGIN = 2.0;

    public static final String HEALTH_STATUS_MESSAGE = "Server room environment is running within optimal parameters";

    private static final Alert HEALTH_STATUS_ALERT = Alert.builder()
            .type(AlertType.HEALTH_STATUS)
            .message(HEALTH_STATUS_MESSAGE)
            .severity(Severity.INFO)
            .build();

    /**
     * Temperature alerts come before humidity alerts. A missing metric raises nothing.
     */
    public List<Alert> evaluate(Metrics metrics, ThresholdConfig config) {
        List<Alert> alerts = new ArrayList<>(2);

        metrics.getTemperature().ifPresent(value -> {
            if (value < config.getTempMin()) {
                alerts.add(alert(AlertType.TEMPERATURE_LOW, value, config.getTempMin(),
                        "Temperature %s°F is below minimum threshold %s°F"));
            } else if (value > config.getTempMax()) {
                alerts.add(alert(AlertType.TEMPERATURE_HIGH, value, config.getTempMax(),
                        "Temperature %s°F is above maximum threshold %s°F"));
            }
        });

        metrics.getHumidity().ifPresent(value -> {
            if (value < config.getHumidityMin()) {
                alerts.add(alert(AlertType.HUMIDITY_LOW, value, config.getHumidityMin(),
                        "Humidity %s%% is below minimum threshold %s%%"));
            } else if (value > config.getHumidityMax()) {
                alerts.add(alert(AlertType.HUMIDITY_HIGH, value, config.getHumidityMax(),
                        "Humidity %s%% is above maximum threshold %s%%"));
            }
        });

        return List.copyOf(alerts);
    }

    public Alert healthStatusAlert() {
        return HEALTH_STATUS_ALERT;
    }

    static Severity severityFor(double value, double bound) {
        return Math.abs(value - bound) <= WARNING_MARGIN ? Severity.WARNING : Severity.CRITICAL;
    }

    private static Alert alert(AlertType type, double value, double bound, String format) {
        return Alert.builder()
                .type(type)
                .message(String.format(Locale.ROOT, format, Double.toString(value), Double.toString(bound)))
                .severity(severityFor(value, bound))
                .build();
    }
}
