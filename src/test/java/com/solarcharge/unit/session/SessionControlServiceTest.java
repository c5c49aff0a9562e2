package com.solarcharge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.enums.SessionStatus;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.ControlResult;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.exception.NotSessionOwnerException;
import com.solarcharge.exception.PortNotFoundException;
import com.solarcharge.exception.PortOccupiedException;
import com.solarcharge.port.PortDirectory;
import com.solarcharge.port.PortStatusService;
import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.session.ChargingSessionStore;
import com.solarcharge.session.CoordinatorWorker;
import com.solarcharge.session.SessionControlService;
import com.solarcharge.session.SessionKey;
import com.solarcharge.session.SessionTerminator;
import com.solarcharge.transport.ControlCommandSender;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Unit tests for SessionControlService covering start, resume, occupancy, the insert race,
 * and stop with and without an ACTIVE session.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SessionControlServiceTest {

    private static final SessionKey KEY = SessionKey.of("ESP32_001", 1);

    @Mock
    private CoordinatorWorker coordinatorWorker;

    @Mock
    private PortDirectory portDirectory;

    @Mock
    private PortStatusService portStatusService;

    @Mock
    private ChargingSessionStore chargingSessionStore;

    @Mock
    private ChargingCoordinator chargingCoordinator;

    @Mock
    private SessionTerminator sessionTerminator;

    @Mock
    private ControlCommandSender controlCommandSender;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private SessionControlService service;

    private final ResolvedPort port = ResolvedPort.builder()
            .portId("P1")
            .stationId("S1")
            .deviceId("ESP32_001")
            .deviceIndex(1)
            .premium(false)
            .build();

    @BeforeEach
    void setUp() {
        service = new SessionControlService(
                coordinatorWorker,
                portDirectory,
                portStatusService,
                chargingSessionStore,
                chargingCoordinator,
                sessionTerminator,
                controlCommandSender,
                eventPublisherHelper,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

        when(coordinatorWorker.call(any())).thenAnswer(inv -> inv.<Callable<?>>getArgument(0).call());
        when(portDirectory.resolvePort("ESP32_001", 1)).thenReturn(port);
        when(controlCommandSender.send(anyString(), Mockito.anyInt(), any())).thenReturn(true);
        when(chargingSessionStore.create(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private static ChargingSession activeOwnedBy(String userId) {
        return ChargingSession.builder()
                .id("SES-1")
                .userId(userId)
                .portId("P1")
                .stationId("S1")
                .status(SessionStatus.ACTIVE)
                .build();
    }

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("free port creates a session, tracks it, sends ON and writes status last")
        void startsNewSession() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.empty());

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.ON, "U1", null);

            ArgumentCaptor<ChargingSession> created = ArgumentCaptor.forClass(ChargingSession.class);
            verify(chargingSessionStore).create(created.capture());
            assertThat(created.getValue().getUserId()).isEqualTo("U1");
            assertThat(created.getValue().getStationId()).isEqualTo("S1");
            assertThat(created.getValue().getStatus()).isEqualTo(SessionStatus.ACTIVE);
            assertThat(created.getValue().getLastActivity()).isNotNull();

            assertThat(result.getSessionId()).isEqualTo(created.getValue().getId());
            assertThat(result.isResumed()).isFalse();
            assertThat(result.getPortStatus()).isEqualTo(PortStatus.CHARGING_FREE);
            assertThat(result.isCommandPublished()).isTrue();

            InOrder order = Mockito.inOrder(chargingCoordinator, controlCommandSender, portStatusService);
            order.verify(chargingCoordinator).track(KEY, result.getSessionId());
            order.verify(controlCommandSender).send("ESP32_001", 1, ControlCommand.ON);
            order.verify(portStatusService).applyStatus("P1", PortStatus.CHARGING_FREE);
            verify(eventPublisherHelper).publishSessionStarted(any(), any(), eq("ESP32_001"), eq(1));
        }

        @Test
        @DisplayName("same user on an ACTIVE port resumes without a second session")
        void resumesOwnSession() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.of(activeOwnedBy("U1")));

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.ON, "U1", null);

            assertThat(result.getSessionId()).isEqualTo("SES-1");
            assertThat(result.isResumed()).isTrue();
            verify(chargingSessionStore, never()).create(any());
            verify(chargingSessionStore).touch(eq("SES-1"), any());
            verify(chargingCoordinator).track(KEY, "SES-1");
        }

        @Test
        @DisplayName("another user's ACTIVE session rejects the start with no side effects")
        void occupiedRejected() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.of(activeOwnedBy("U1")));

            assertThatThrownBy(() -> service.control("ESP32_001", 1, ControlCommand.ON, "U2", null))
                    .isInstanceOf(PortOccupiedException.class);

            verify(controlCommandSender, never()).send(anyString(), Mockito.anyInt(), any());
            verify(portStatusService, never()).applyStatus(any(), any());
            verify(chargingCoordinator, never()).track(any(), any());
        }

        @Test
        @DisplayName("losing the insert race to another user surfaces as occupied")
        void insertRaceLost() {
            when(chargingSessionStore.findActiveByPort("P1"))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(activeOwnedBy("U2")));
            when(chargingSessionStore.create(any())).thenThrow(new DataIntegrityViolationException("unique"));

            assertThatThrownBy(() -> service.control("ESP32_001", 1, ControlCommand.ON, "U1", null))
                    .isInstanceOf(PortOccupiedException.class);
        }

        @Test
        @DisplayName("losing the insert race to the same user resumes")
        void insertRaceSameUser() {
            when(chargingSessionStore.findActiveByPort("P1"))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(activeOwnedBy("U1")));
            when(chargingSessionStore.create(any())).thenThrow(new DataIntegrityViolationException("unique"));

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.ON, "U1", null);

            assertThat(result.getSessionId()).isEqualTo("SES-1");
            assertThat(result.isResumed()).isTrue();
        }

        @Test
        @DisplayName("publish failure still starts the session and reports commandPublished=false")
        void publishFailure() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.empty());
            when(controlCommandSender.send("ESP32_001", 1, ControlCommand.ON)).thenReturn(false);

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.ON, "U1", null);

            assertThat(result.getSessionId()).isNotNull();
            assertThat(result.isCommandPublished()).isFalse();
            verify(portStatusService).applyStatus("P1", PortStatus.CHARGING_FREE);
        }

        @Test
        @DisplayName("unknown port fails before any store access")
        void unknownPort() {
            when(portDirectory.resolvePort("ESP32_001", 7)).thenThrow(new PortNotFoundException("ESP32_001", 7));

            assertThatThrownBy(() -> service.control("ESP32_001", 7, ControlCommand.ON, "U1", null))
                    .isInstanceOf(PortNotFoundException.class);
            verify(chargingSessionStore, never()).findActiveByPort(any());
        }
    }

    @Nested
    @DisplayName("Stop")
    class Stop {

        @Test
        @DisplayName("owner stop completes with USER_STOP, releases and turns the port off")
        void ownerStops() {
            ChargingSession session = activeOwnedBy("U1");
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.of(session));

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.OFF, "U1", null);

            assertThat(result.getSessionId()).isEqualTo("SES-1");
            assertThat(result.getPortStatus()).isEqualTo(PortStatus.AVAILABLE);
            verify(sessionTerminator).complete(session, SessionCloseReason.USER_STOP, "ESP32_001", 1);
            verify(chargingCoordinator).release(KEY);
            verify(controlCommandSender).send("ESP32_001", 1, ControlCommand.OFF);
            verify(portStatusService).applyStatus("P1", PortStatus.AVAILABLE);
        }

        @Test
        @DisplayName("non-owner stop is rejected and leaves the session untouched")
        void nonOwnerRejected() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.of(activeOwnedBy("U1")));

            assertThatThrownBy(() -> service.control("ESP32_001", 1, ControlCommand.OFF, "U2", null))
                    .isInstanceOf(NotSessionOwnerException.class);

            verify(sessionTerminator, never()).complete(any(), any(), any(), any());
            verify(controlCommandSender, never()).send(anyString(), Mockito.anyInt(), any());
        }

        @Test
        @DisplayName("stop with no ACTIVE session still turns the port off")
        void stopWithoutSession() {
            when(chargingSessionStore.findActiveByPort("P1")).thenReturn(Optional.empty());

            ControlResult result = service.control("ESP32_001", 1, ControlCommand.OFF, "U1", null);

            assertThat(result.getSessionId()).isNull();
            verify(chargingCoordinator).release(KEY);
            verify(controlCommandSender).send("ESP32_001", 1, ControlCommand.OFF);
            verify(portStatusService).applyStatus("P1", PortStatus.AVAILABLE);
            verify(eventPublisherHelper).publishStopWithoutSession(any(), eq("U1"), eq("ESP32_001"), eq(1));
        }
    }
}
