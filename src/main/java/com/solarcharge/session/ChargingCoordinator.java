package com.solarcharge.session;

import com.solarcharge.config.CoordinatorSettings;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.transport.ControlCommandSender;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns the session registry and the inactivity timers.
 *
 * <p>All methods are meant to run on the coordinator worker; timers are scheduled on the
 * same single-thread scheduler, so a timer firing never interleaves with a telemetry
 * update or a control request.
 *
 * <p>When a timer fires the session is re-read from the store and inactivity is measured
 * from the persisted last-activity time. If the session is still within the timeout the
 * timer is re-armed for the remainder; otherwise it is completed and its port turned off.
 */
@Component
public class ChargingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ChargingCoordinator.class);

    private final SessionRegistry registry = new SessionRegistry();
    private final InactivityTimerManager timers;
    private final ChargingSessionStore chargingSessionStore;
    private final SessionTerminator sessionTerminator;
    private final ControlCommandSender controlCommandSender;
    private final Clock clock;
    private final Duration inactivityTimeout;

    public ChargingCoordinator(
            @Qualifier("coordinatorScheduler") TaskScheduler coordinatorScheduler,
            ChargingSessionStore chargingSessionStore,
            SessionTerminator sessionTerminator,
            ControlCommandSender controlCommandSender,
            CoordinatorSettings coordinatorSettings,
            Clock clock) {
        this.chargingSessionStore = chargingSessionStore;
        this.sessionTerminator = sessionTerminator;
        this.controlCommandSender = controlCommandSender;
        this.clock = clock;
        this.inactivityTimeout = coordinatorSettings.getInactivityTimeout();
        this.timers = new InactivityTimerManager(coordinatorScheduler, clock, this::onDeadline);
    }

    /** Records the session for the key and (re)arms its inactivity timer. */
    public void track(SessionKey key, String sessionId) {
        if (timers.isClosed()) {
            log.warn("Coordinator stopped, session not tracked: key={}, sessionId={}", key, sessionId);
            return;
        }
        registry.track(key, sessionId).filter(previous -> !previous.equals(sessionId)).ifPresent(previous ->
                log.warn("Registry entry replaced: key={}, previous={}, current={}", key, previous, sessionId));
        timers.arm(key, inactivityTimeout);
    }

    public Optional<String> sessionFor(SessionKey key) {
        return registry.sessionFor(key);
    }

    /**
     * Registry lookup that falls back to the store. An ACTIVE session found in the store
     * (e.g. after a restart) is adopted into the registry with a fresh timer.
     */
    public Optional<String> findOrAdopt(SessionKey key, String portId) {
        Optional<String> tracked = registry.sessionFor(key);
        if (tracked.isPresent()) {
            return tracked;
        }
        Optional<ChargingSession> active = chargingSessionStore.findActiveByPort(portId);
        active.ifPresent(session -> {
            log.info("Adopted ACTIVE session into registry: key={}, sessionId={}", key, session.getId());
            track(key, session.getId());
        });
        return active.map(ChargingSession::getId);
    }

    /** Restarts the inactivity window for a tracked key. */
    public void refreshActivity(SessionKey key) {
        if (registry.sessionFor(key).isPresent()) {
            timers.arm(key, inactivityTimeout);
        }
    }

    public void release(SessionKey key) {
        registry.release(key);
        timers.cancel(key);
    }

    /** Releases the key only if it still tracks {@code sessionId}. */
    public boolean releaseSession(SessionKey key, String sessionId) {
        if (registry.release(key, sessionId)) {
            timers.cancel(key);
            return true;
        }
        return false;
    }

    /** Releases whichever key tracks {@code sessionId}, if any. */
    public boolean releaseSession(String sessionId) {
        return registry.keyOf(sessionId).map(key -> releaseSession(key, sessionId)).orElse(false);
    }

    public boolean isStopped() {
        return timers.isClosed();
    }

    void onDeadline(SessionKey key) {
        Optional<String> tracked = registry.sessionFor(key);
        if (tracked.isEmpty()) {
            return;
        }
        String sessionId = tracked.get();

        ChargingSession session;
        try {
            session = chargingSessionStore.findById(sessionId).orElse(null);
        } catch (DataAccessException e) {
            // Registry entry kept; the next sample re-arms, the reconciler covers the rest
            log.error("Inactivity check failed, store unavailable: key={}, sessionId={}", key, sessionId, e);
            return;
        }

        if (session == null || !session.isActive()) {
            log.info("Timer fired for a session no longer ACTIVE, releasing: key={}, sessionId={}", key, sessionId);
            registry.release(key, sessionId);
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Duration idle = session.getLastActivity() != null
                ? Duration.between(session.getLastActivity(), now)
                : inactivityTimeout;

        if (idle.compareTo(inactivityTimeout) < 0) {
            Duration remaining = inactivityTimeout.minus(idle);
            log.info(
                    "Timer fired early, re-arming: key={}, sessionId={}, idle={}s, remaining={}s",
                    key,
                    sessionId,
                    idle.toSeconds(),
                    remaining.toSeconds());
            timers.arm(key, remaining);
            return;
        }

        log.info("Inactivity timeout: key={}, sessionId={}, idle={}s", key, sessionId, idle.toSeconds());
        try {
            sessionTerminator.complete(session, SessionCloseReason.INACTIVITY, key.getDeviceId(), key.getPortIndex());
        } catch (DataAccessException e) {
            log.error("Inactivity completion failed, retrying after timeout: key={}, sessionId={}", key, sessionId, e);
            timers.arm(key, inactivityTimeout);
            return;
        }
        controlCommandSender.send(key.getDeviceId(), key.getPortIndex(), ControlCommand.OFF);
        release(key);
    }

    /**
     * Cancels every timer and forgets all tracked sessions. Called once, on shutdown; later
     * {@link #track} and {@link #refreshActivity} calls are ignored.
     */
    public int shutdown() {
        int cancelled = timers.close();
        registry.clear();
        log.info("Coordinator stopped: timersCancelled={}", cancelled);
        return cancelled;
    }

    public boolean isArmed(SessionKey key) {
        return timers.isArmed(key);
    }

    public int trackedCount() {
        return registry.size();
    }

    public int armedCount() {
        return timers.armedCount();
    }

    public Map<SessionKey, String> trackedSessions() {
        return registry.snapshot();
    }
}
