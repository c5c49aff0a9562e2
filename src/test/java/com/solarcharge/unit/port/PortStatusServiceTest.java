package com.solarcharge.unit.port;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.domain.model.StatusTelemetry;
import com.solarcharge.entity.CurrentDeviceStatusEntity;
import com.solarcharge.entity.DeviceStatusLogEntity;
import com.solarcharge.port.PortStatusService;
import com.solarcharge.repository.jpa.ChargingPortJpaRepository;
import com.solarcharge.repository.jpa.CurrentDeviceStatusJpaRepository;
import com.solarcharge.repository.jpa.DeviceStatusLogJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PortStatusServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ChargingPortJpaRepository chargingPortJpaRepository;

    @Mock
    private DeviceStatusLogJpaRepository deviceStatusLogJpaRepository;

    @Mock
    private CurrentDeviceStatusJpaRepository currentDeviceStatusJpaRepository;

    private PortStatusService portStatusService;

    @BeforeEach
    void setUp() {
        portStatusService = new PortStatusService(
                chargingPortJpaRepository,
                deviceStatusLogJpaRepository,
                currentDeviceStatusJpaRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("applyStatus derives occupied from the status")
    void applyStatusDerivesOccupied() {
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        when(chargingPortJpaRepository.updateStatus("P1", PortStatus.CHARGING_FREE, true, now))
                .thenReturn(1);

        portStatusService.applyStatus("P1", PortStatus.CHARGING_FREE);

        verify(chargingPortJpaRepository).updateStatus("P1", PortStatus.CHARGING_FREE, true, now);
    }

    @Test
    @DisplayName("device status writes log row, current status and premium-aware port status")
    void recordDeviceStatus() {
        ResolvedPort port = ResolvedPort.builder()
                .portId("P1")
                .stationId("S1")
                .deviceId("ESP32_001")
                .deviceIndex(1)
                .premium(true)
                .build();
        StatusTelemetry telemetry = StatusTelemetry.builder()
                .deviceId("ESP32_001")
                .portIndex(1)
                .connectivity("online")
                .chargerState(ChargerState.ON)
                .build();
        when(chargingPortJpaRepository.updateStatus(eq("P1"), eq(PortStatus.CHARGING_PREMIUM), eq(true), any()))
                .thenReturn(1);

        PortStatus status = portStatusService.recordDeviceStatus(telemetry, port);

        assertThat(status).isEqualTo(PortStatus.CHARGING_PREMIUM);

        ArgumentCaptor<DeviceStatusLogEntity> logCaptor = ArgumentCaptor.forClass(DeviceStatusLogEntity.class);
        verify(deviceStatusLogJpaRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().getStatusMessage()).isEqualTo("online");
        assertThat(logCaptor.getValue().getPortId()).isEqualTo("P1");

        ArgumentCaptor<CurrentDeviceStatusEntity> currentCaptor =
                ArgumentCaptor.forClass(CurrentDeviceStatusEntity.class);
        verify(currentDeviceStatusJpaRepository).save(currentCaptor.capture());
        assertThat(currentCaptor.getValue().getChargerState()).isEqualTo(ChargerState.ON);
    }

    @Test
    @DisplayName("device-reported time stamps the port, the status log and the current status")
    void deviceTimestampStampsEveryRow() {
        LocalDateTime reported = LocalDateTime.of(2024, 5, 1, 9, 58, 30);
        ResolvedPort port = ResolvedPort.builder()
                .portId("P1")
                .stationId("S1")
                .deviceId("ESP32_001")
                .deviceIndex(1)
                .premium(false)
                .build();
        StatusTelemetry telemetry = StatusTelemetry.builder()
                .deviceId("ESP32_001")
                .portIndex(1)
                .connectivity("online")
                .chargerState(ChargerState.OFF)
                .timestamp(reported)
                .build();
        when(chargingPortJpaRepository.updateStatus("P1", PortStatus.AVAILABLE, false, reported))
                .thenReturn(1);

        portStatusService.recordDeviceStatus(telemetry, port);

        verify(chargingPortJpaRepository).updateStatus("P1", PortStatus.AVAILABLE, false, reported);
        ArgumentCaptor<DeviceStatusLogEntity> logCaptor = ArgumentCaptor.forClass(DeviceStatusLogEntity.class);
        verify(deviceStatusLogJpaRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().getTimestamp()).isEqualTo(reported);
        ArgumentCaptor<CurrentDeviceStatusEntity> currentCaptor =
                ArgumentCaptor.forClass(CurrentDeviceStatusEntity.class);
        verify(currentDeviceStatusJpaRepository).save(currentCaptor.capture());
        assertThat(currentCaptor.getValue().getLastUpdate()).isEqualTo(reported);
    }
}
