package com.solarcharge.session;

import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.CompletedSession;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.pricing.CostCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The single ACTIVE to COMPLETED transition shared by stop requests, inactivity timers and
 * the reconciler. Prices the session from its accumulated energy, then applies a
 * conditional update: when several paths race on one session exactly one wins.
 *
 * <p>Does not touch registry, timers, port status or the device; callers do that.
 */
@Component
public class SessionTerminator {

    private static final Logger log = LoggerFactory.getLogger(SessionTerminator.class);

    private final ChargingSessionStore chargingSessionStore;
    private final CostCalculator costCalculator;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public SessionTerminator(
            ChargingSessionStore chargingSessionStore,
            CostCalculator costCalculator,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.chargingSessionStore = chargingSessionStore;
        this.costCalculator = costCalculator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * @return the completion, or empty if the session was already completed by another path
     */
    public Optional<CompletedSession> complete(
            ChargingSession session, SessionCloseReason reason, String deviceId, Integer portIndex) {
        BigDecimal cost = costCalculator.cost(session.getId(), session.getEnergyKwh());
        LocalDateTime endTime = LocalDateTime.now(clock);

        if (!chargingSessionStore.completeIfActive(session.getId(), cost, endTime)) {
            log.info("Session already completed, skipping: sessionId={}, reason={}", session.getId(), reason);
            return Optional.empty();
        }

        CompletedSession completed = CompletedSession.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .energyKwh(session.getEnergyKwh())
                .chargeMah(session.getChargeMah())
                .cost(cost)
                .endTime(endTime)
                .reason(reason)
                .build();

        log.info(
                "Session completed: sessionId={}, reason={}, energyKwh={}, chargeMah={}, cost={}",
                session.getId(),
                reason,
                String.format("%.6f", session.getEnergyKwh()),
                String.format("%.2f", session.getChargeMah()),
                cost);
        eventPublisherHelper.publishSessionCompleted(this, completed, deviceId, portIndex);
        return Optional.of(completed);
    }
}
