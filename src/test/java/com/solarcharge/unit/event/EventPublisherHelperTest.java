package com.solarcharge.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.CompletedSession;
import com.solarcharge.event.ChargingSessionEvent;
import com.solarcharge.event.ChargingSessionEventType;
import com.solarcharge.event.EventPublisherHelper;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper helper;

    @BeforeEach
    void setUp() {
        helper = new EventPublisherHelper(applicationEventPublisher);
    }

    private ChargingSessionEvent published() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return (ChargingSessionEvent) captor.getValue();
    }

    @Test
    @DisplayName("completion reason selects the event type")
    void completionTypes() {
        helper.publishSessionCompleted(
                this,
                CompletedSession.builder()
                        .sessionId("SES-1")
                        .userId("U1")
                        .energyKwh(1.0)
                        .cost(new BigDecimal("0.25"))
                        .reason(SessionCloseReason.STALE_RECONCILIATION)
                        .build(),
                "ESP32_001",
                1);

        ChargingSessionEvent event = published();
        assertThat(event.getEventType()).isEqualTo(ChargingSessionEventType.STALE_COMPLETED);
        assertThat(event.isCompletion()).isTrue();
        assertThat(event.getCost()).isEqualByComparingTo("0.25");
    }

    @Test
    @DisplayName("start carries session and device coordinates")
    void started() {
        helper.publishSessionStarted(
                this, ChargingSession.builder().id("SES-1").userId("U1").build(), "ESP32_001", 2);

        ChargingSessionEvent event = published();
        assertThat(event.getEventType()).isEqualTo(ChargingSessionEventType.STARTED);
        assertThat(event.getPortIndex()).isEqualTo(2);
        assertThat(event.isCompletion()).isFalse();
    }
}
