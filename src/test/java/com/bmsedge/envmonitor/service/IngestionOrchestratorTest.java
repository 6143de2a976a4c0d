package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.exception.StoreWriteException;
import com.bmsedge.envmonitor.model.HealthStatus;
import com.bmsedge.envmonitor.model.Metrics;
import com.bmsedge.envmonitor.model.SensorMetadata;
import com.bmsedge.envmonitor.model.SensorReading;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.bmsedge.envmonitor.repository.TelemetryStoreGateway;
import com.bmsedge.envmonitor.service.IngestionOrchestrator.CycleOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final SensorMetadata METADATA = SensorMetadata.builder().location("MCW").sensorId("SR001").build();

    @Mock
    private SensorSimulator sensorSimulator;
    @Mock
    private AlertPublisher alertPublisher;
    @Mock
    private TelemetryStoreGateway gateway;
    @Mock
    private RetentionService retentionService;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestrator(true);
    }

    @Test
    void storesEvaluatedReadingAndVerifiesIt() {
        when(sensorSimulator.generateReading()).thenReturn(reading(85.0, 50.0));
        when(gateway.insert(any())).thenReturn("id-1");
        when(gateway.findById("id-1")).thenReturn(Optional.of(reading(85.0, 50.0)));

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.STORED);

        ArgumentCaptor<TelemetryDocument> captor = ArgumentCaptor.forClass(TelemetryDocument.class);
        verify(gateway).insert(captor.capture());
        assertThat(captor.getValue().getAlerts()).hasSize(1);

        InOrder order = inOrder(alertPublisher, gateway);
        order.verify(alertPublisher).logAlerts(captor.getValue().getAlerts());
        order.verify(gateway).insert(captor.getValue());
        order.verify(gateway).findById("id-1");
        order.verify(alertPublisher).publish(captor.getValue());
    }

    @Test
    void failedWriteIsLoggedButNotBroadcast() {
        when(sensorSimulator.generateReading()).thenReturn(reading(85.0, 50.0));
        when(gateway.insert(any())).thenThrow(new StoreWriteException("insert failed", null));

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.WRITE_FAILED);

        verify(alertPublisher).logAlerts(any());
        verify(alertPublisher, never()).publish(any());
    }

    @Test
    void unverifiedReadingIsNotBroadcast() {
        when(sensorSimulator.generateReading()).thenReturn(reading(85.0, 50.0));
        when(gateway.insert(any())).thenReturn("id-4");
        when(gateway.findById("id-4")).thenReturn(Optional.empty());

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.VERIFICATION_FAILED);

        verify(alertPublisher, never()).publish(any());
    }

    @Test
    void writeFailureDoesNotStopNextCycle() {
        when(sensorSimulator.generateReading()).thenReturn(reading(70.0, 50.0));
        when(gateway.insert(any()))
                .thenThrow(new StoreWriteException("insert failed", null))
                .thenReturn("id-2");
        when(gateway.findById("id-2")).thenReturn(Optional.of(reading(70.0, 50.0)));

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.WRITE_FAILED);
        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.STORED);
    }

    @Test
    void missingReadBackIsVerificationFailure() {
        when(sensorSimulator.generateReading()).thenReturn(reading(70.0, 50.0));
        when(gateway.insert(any())).thenReturn("id-3");
        when(gateway.findById("id-3")).thenReturn(Optional.empty());

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.VERIFICATION_FAILED);
    }

    @Test
    void unexpectedErrorIsContained() {
        when(sensorSimulator.generateReading()).thenThrow(new IllegalStateException("sensor offline"));

        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.FAILED);
    }

    @Test
    void disabledIngestionSkipsWork() {
        IngestionOrchestrator disabled = orchestrator(false);

        assertThat(disabled.runCycle()).isEqualTo(CycleOutcome.SKIPPED);
        disabled.runHealthMaintenance();
        verifyNoInteractions(sensorSimulator, gateway, retentionService);
    }

    @Test
    void nothingRunsAfterShutdown() {
        orchestrator.shutdown();

        assertThat(orchestrator.isStopped()).isTrue();
        assertThat(orchestrator.runCycle()).isEqualTo(CycleOutcome.SKIPPED);
        verifyNoInteractions(gateway);
    }

    @Test
    void healthMaintenanceWritesMarkerThenPurges() {
        HealthStatus status = HealthStatus.builder()
                .timestamp(NOW)
                .metadata(METADATA)
                .message("ok")
                .alert(new ThresholdEvaluator().healthStatusAlert())
                .build();
        when(sensorSimulator.generateHealthStatus()).thenReturn(status);
        when(gateway.insert(status)).thenThrow(new StoreWriteException("insert failed", null));
        when(retentionService.purgeExpired()).thenReturn(4L);

        orchestrator.runHealthMaintenance();

        verify(retentionService).purgeExpired();
        assertThat(orchestrator.getLastHealthCheck()).contains(NOW);
        verify(gateway, never()).findById(any());
    }

    private IngestionOrchestrator orchestrator(boolean enabled) {
        return new IngestionOrchestrator(sensorSimulator, new ThresholdEvaluator(), new ThresholdService(63, 80, 40, 60),
                alertPublisher, gateway, retentionService, clock, enabled, 60000);
    }

    private static SensorReading reading(double temperature, double humidity) {
        return SensorReading.builder()
                .timestamp(NOW)
                .metadata(METADATA)
                .metrics(Metrics.of(temperature, humidity))
                .build();
    }
}
