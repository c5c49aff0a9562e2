package com.solarcharge.reconciliation;

import com.solarcharge.config.CoordinatorSettings;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.model.ChargingPort;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.CompletedSession;
import com.solarcharge.domain.model.StaleSession;
import com.solarcharge.domain.model.StaleSweepResult;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.port.PortDirectory;
import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.session.ChargingSessionStore;
import com.solarcharge.session.CoordinatorWorker;
import com.solarcharge.session.SessionKey;
import com.solarcharge.session.SessionTerminator;
import com.solarcharge.transport.ControlCommandSender;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Force-completes ACTIVE sessions whose last activity is older than twice the inactivity
 * timeout.
 *
 * <p>Works from the store alone, so it recovers sessions whose timers were lost to a
 * restart, a store error at fire time, or a silent device. Runs at startup, then on a
 * fixed delay (default 5 minutes), and on manual API trigger. Scheduled runs execute on
 * the coordinator worker like every other unit of work.
 *
 * <p>A failure on one session is recorded in the result and the sweep moves on.
 */
@Service
public class StaleSessionReconciler {

    private static final Logger log = LoggerFactory.getLogger(StaleSessionReconciler.class);

    private final ChargingSessionStore chargingSessionStore;
    private final PortDirectory portDirectory;
    private final SessionTerminator sessionTerminator;
    private final ControlCommandSender controlCommandSender;
    private final ChargingCoordinator chargingCoordinator;
    private final CoordinatorWorker coordinatorWorker;
    private final EventPublisherHelper eventPublisherHelper;
    private final Duration staleAfter;
    private final Clock clock;

    public StaleSessionReconciler(
            ChargingSessionStore chargingSessionStore,
            PortDirectory portDirectory,
            SessionTerminator sessionTerminator,
            ControlCommandSender controlCommandSender,
            ChargingCoordinator chargingCoordinator,
            CoordinatorWorker coordinatorWorker,
            EventPublisherHelper eventPublisherHelper,
            CoordinatorSettings coordinatorSettings,
            Clock clock) {
        this.chargingSessionStore = chargingSessionStore;
        this.portDirectory = portDirectory;
        this.sessionTerminator = sessionTerminator;
        this.controlCommandSender = controlCommandSender;
        this.chargingCoordinator = chargingCoordinator;
        this.coordinatorWorker = coordinatorWorker;
        this.eventPublisherHelper = eventPublisherHelper;
        this.staleAfter = coordinatorSettings.staleAfter();
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${solarcharge.reconciler.interval-ms:300000}",
            initialDelayString = "${solarcharge.reconciler.initial-delay-ms:0}")
    public void scheduledSweep() {
        sweep("SCHEDULED");
    }

    public StaleSweepResult manualSweep() {
        return coordinatorWorker.call(() -> sweep("MANUAL"));
    }

    public StaleSweepResult sweep(String trigger) {
        long startTime = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(staleAfter);

        StaleSweepResult result = StaleSweepResult.builder()
                .trigger(trigger)
                .timestamp(now)
                .cutoff(cutoff)
                .build();

        List<ChargingSession> idle;
        try {
            idle = chargingSessionStore.findIdleBefore(cutoff);
        } catch (RuntimeException e) {
            log.error("Stale session scan failed: trigger={}", trigger, e);
            result.getFailures().add(StaleSweepResult.SweepFailure.builder()
                    .reason("Scan failed: " + e.getMessage())
                    .build());
            result.setDurationMs(System.currentTimeMillis() - startTime);
            return result;
        }
        result.setStaleFound(idle.size());

        for (ChargingSession session : idle) {
            try {
                reconcile(toStale(session, now), result);
            } catch (RuntimeException e) {
                log.error("Stale session not reconciled: sessionId={}", session.getId(), e);
                result.getFailures().add(StaleSweepResult.SweepFailure.builder()
                        .sessionId(session.getId())
                        .reason(e.getMessage())
                        .build());
            }
        }

        result.setDurationMs(System.currentTimeMillis() - startTime);
        if (result.getStaleFound() > 0 || result.hasFailures()) {
            log.info(
                    "Stale session sweep: trigger={}, found={}, completed={}, alreadyClosed={}, failures={}, durationMs={}",
                    trigger,
                    result.getStaleFound(),
                    result.getCompleted(),
                    result.getAlreadyClosed(),
                    result.getFailures().size(),
                    result.getDurationMs());
            eventPublisherHelper.publishStaleSweep(this, result);
        } else {
            log.debug("Stale session sweep: trigger={}, nothing stale", trigger);
        }
        return result;
    }

    private void reconcile(StaleSession stale, StaleSweepResult result) {
        ChargingSession session = stale.getSession();
        log.warn(
                "Stale session found: sessionId={}, portId={}, idleSeconds={}",
                session.getId(),
                session.getPortId(),
                stale.getSecondsSinceActivity());

        Optional<CompletedSession> completed = sessionTerminator.complete(
                session, SessionCloseReason.STALE_RECONCILIATION, stale.getDeviceId(), stale.getDeviceIndex());

        if (stale.hasDevice()) {
            chargingCoordinator.releaseSession(SessionKey.of(stale.getDeviceId(), stale.getDeviceIndex()), session.getId());
        }
        chargingCoordinator.releaseSession(session.getId());

        if (completed.isEmpty()) {
            result.setAlreadyClosed(result.getAlreadyClosed() + 1);
            return;
        }
        result.setCompleted(result.getCompleted() + 1);

        if (stale.hasDevice()) {
            controlCommandSender.send(stale.getDeviceId(), stale.getDeviceIndex(), ControlCommand.OFF);
        } else {
            log.warn("Stale session completed but port has no device mapping, OFF not sent: sessionId={}, portId={}",
                    session.getId(), session.getPortId());
        }
    }

    private StaleSession toStale(ChargingSession session, LocalDateTime now) {
        Optional<ChargingPort> port = portDirectory.findPort(session.getPortId());
        long idleSeconds = session.getLastActivity() != null
                ? Duration.between(session.getLastActivity(), now).toSeconds()
                : Duration.between(session.getStartTime(), now).toSeconds();
        return StaleSession.builder()
                .session(session)
                .deviceId(port.map(ChargingPort::getDeviceId).orElse(null))
                .deviceIndex(port.map(ChargingPort::getDeviceIndex).orElse(null))
                .secondsSinceActivity(idleSeconds)
                .build();
    }
}
