package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.dto.DataQualityDTO;
import com.bmsedge.envmonitor.model.Metric;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import com.bmsedge.envmonitor.service.TelemetryQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TelemetryQueryController.class)
class TelemetryQueryControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TelemetryQueryService queryService;

    @Test
    void recentReturnsReadings() throws Exception {
        given(queryService.recent(24, "MCW", null, null)).willReturn(List.of(SensorReading.builder()
                .id("663e0d9f8f1b2c3d4e5f6a7b")
                .timestamp(NOW)
                .metadata(SensorMetadata.builder().location("MCW").sensorId("SR001").build())
                .metrics(Metrics.of(70.0, 50.0))
                .build()));

        mockMvc.perform(get("/api/telemetry/recent").param("location", "MCW"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("READING"))
                .andExpect(jsonPath("$[0].temperature").value(70.0))
                .andExpect(jsonPath("$[0].sensorId").value("SR001"));
    }

    @Test
    void trendAcceptsMetricNameCaseInsensitively() throws Exception {
        given(queryService.trend(eq(Metric.HUMIDITY), any())).willReturn(List.of());

        mockMvc.perform(get("/api/telemetry/trends/Humidity").param("days", "3"))
                .andExpect(status().isOk());

        verify(queryService).trend(eq(Metric.HUMIDITY), any());
    }

    @Test
    void unknownMetricIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/telemetry/trends/pressure"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void invalidWindowIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/telemetry/alerts/summary").param("days", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void absentAggregateIsNotFound() throws Exception {
        given(queryService.aggregatedMetrics(any())).willReturn(Optional.empty());

        mockMvc.perform(get("/api/telemetry/aggregate")
                        .param("start", "2024-05-10T00:00:00Z")
                        .param("end", "2024-05-10T12:00:00Z"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No data found for aggregation"));
    }

    @Test
    void qualityReportsCompleteness() throws Exception {
        given(queryService.dataQuality(1)).willReturn(Optional.of(DataQualityDTO.builder()
                .periodDays(1)
                .expectedReadings(1440)
                .actualReadings(720)
                .missingReadings(720)
                .missingPercentage(50.0)
                .completenessPercentage(50.0)
                .build()));

        mockMvc.perform(get("/api/telemetry/quality").param("days", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expectedReadings").value(1440))
                .andExpect(jsonPath("$.completenessPercentage").value(50.0));
    }
}
