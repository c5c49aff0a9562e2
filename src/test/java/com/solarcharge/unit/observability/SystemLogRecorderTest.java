package com.solarcharge.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.LogSource;
import com.solarcharge.domain.enums.LogType;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.enums.TelemetryKind;
import com.solarcharge.event.ChargingSessionEvent;
import com.solarcharge.event.ChargingSessionEventType;
import com.solarcharge.event.ControlCommandEvent;
import com.solarcharge.event.TelemetryEvent;
import com.solarcharge.event.TelemetryEventType;
import com.solarcharge.entity.SystemLogEntity;
import com.solarcharge.observability.SystemLogRecorder;
import com.solarcharge.repository.jpa.SystemLogJpaRepository;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class SystemLogRecorderTest {

    @Mock
    private SystemLogJpaRepository systemLogJpaRepository;

    private SystemLogRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new SystemLogRecorder(systemLogJpaRepository);
    }

    private SystemLogEntity saved() {
        ArgumentCaptor<SystemLogEntity> captor = ArgumentCaptor.forClass(SystemLogEntity.class);
        verify(systemLogJpaRepository).save(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("inactivity completion is a BACKEND INFO entry with the user id")
    void autoCompleted() {
        recorder.onSessionEvent(new ChargingSessionEvent(
                this,
                ChargingSessionEventType.AUTO_COMPLETED,
                "SES-1",
                "U1",
                "ESP32_001",
                1,
                SessionCloseReason.INACTIVITY,
                0.5,
                new BigDecimal("0.1250")));

        SystemLogEntity entry = saved();
        assertThat(entry.getLogType()).isEqualTo(LogType.INFO);
        assertThat(entry.getSource()).isEqualTo(LogSource.BACKEND);
        assertThat(entry.getUserId()).isEqualTo("U1");
        assertThat(entry.getMessage()).contains("SES-1").contains("inactivity");
    }

    @Test
    @DisplayName("user stop is an API entry")
    void userStop() {
        recorder.onSessionEvent(new ChargingSessionEvent(
                this,
                ChargingSessionEventType.STOPPED,
                "SES-1",
                "U1",
                "ESP32_001",
                1,
                SessionCloseReason.USER_STOP,
                0.5,
                new BigDecimal("0.1250")));

        assertThat(saved().getSource()).isEqualTo(LogSource.API);
    }

    @Test
    @DisplayName("dropped telemetry is an MQTT WARNING; accepted samples are not logged")
    void telemetry() {
        recorder.onTelemetryEvent(
                new TelemetryEvent(this, TelemetryEventType.ACCEPTED, TelemetryKind.USAGE, "ESP32_001", 1, "120W"));
        verify(systemLogJpaRepository, never()).save(any());

        recorder.onTelemetryEvent(
                new TelemetryEvent(this, TelemetryEventType.DROPPED, TelemetryKind.USAGE, "ESP32_001", 1, "zero"));

        SystemLogEntity entry = saved();
        assertThat(entry.getLogType()).isEqualTo(LogType.WARNING);
        assertThat(entry.getSource()).isEqualTo(LogSource.MQTT);
    }

    @Test
    @DisplayName("failed publish is an ERROR entry")
    void publishFailure() {
        recorder.onControlCommand(
                new ControlCommandEvent(this, "ESP32_001", 1, ControlCommand.OFF, false, "not connected"));

        assertThat(saved().getLogType()).isEqualTo(LogType.ERROR);
    }

    @Test
    @DisplayName("store failure while logging is swallowed")
    void storeFailureSwallowed() {
        when(systemLogJpaRepository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        recorder.onControlCommand(
                new ControlCommandEvent(this, "ESP32_001", 1, ControlCommand.OFF, false, "not connected"));

        verify(systemLogJpaRepository).save(any());
    }
}
