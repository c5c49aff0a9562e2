package com.solarcharge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.enums.SessionStatus;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.CompletedSession;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.pricing.CostCalculator;
import com.solarcharge.session.ChargingSessionStore;
import com.solarcharge.session.SessionTerminator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionTerminatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T11:00:00Z");

    @Mock
    private ChargingSessionStore chargingSessionStore;

    @Mock
    private CostCalculator costCalculator;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private SessionTerminator terminator;

    private final ChargingSession session = ChargingSession.builder()
            .id("SES-1")
            .userId("U1")
            .portId("P1")
            .status(SessionStatus.ACTIVE)
            .energyKwh(2.0)
            .chargeMah(1500)
            .build();

    @BeforeEach
    void setUp() {
        terminator = new SessionTerminator(
                chargingSessionStore, costCalculator, eventPublisherHelper, Clock.fixed(NOW, ZoneOffset.UTC));
        when(costCalculator.cost("SES-1", 2.0)).thenReturn(new BigDecimal("0.5000"));
    }

    @Test
    @DisplayName("winning transition records cost and end time and publishes the completion")
    void completes() {
        LocalDateTime end = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        when(chargingSessionStore.completeIfActive("SES-1", new BigDecimal("0.5000"), end))
                .thenReturn(true);

        Optional<CompletedSession> completed =
                terminator.complete(session, SessionCloseReason.USER_STOP, "ESP32_001", 1);

        assertThat(completed).isPresent();
        assertThat(completed.get().getCost()).isEqualByComparingTo("0.5");
        assertThat(completed.get().getEndTime()).isEqualTo(end);
        assertThat(completed.get().getReason()).isEqualTo(SessionCloseReason.USER_STOP);
        verify(eventPublisherHelper).publishSessionCompleted(any(), eq(completed.get()), eq("ESP32_001"), eq(1));
    }

    @Test
    @DisplayName("losing transition returns empty and publishes nothing")
    void alreadyCompleted() {
        when(chargingSessionStore.completeIfActive(eq("SES-1"), any(), any())).thenReturn(false);

        assertThat(terminator.complete(session, SessionCloseReason.INACTIVITY, "ESP32_001", 1))
                .isEmpty();
        verify(eventPublisherHelper, never()).publishSessionCompleted(any(), any(), any(), any());
    }
}
