package com.solarcharge.session;

import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.domain.enums.SessionCloseReason;
import com.solarcharge.domain.enums.SessionStatus;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.ControlResult;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.exception.NotSessionOwnerException;
import com.solarcharge.exception.PortOccupiedException;
import com.solarcharge.exception.TransientIoException;
import com.solarcharge.port.PortDirectory;
import com.solarcharge.port.PortStatusMapper;
import com.solarcharge.port.PortStatusService;
import com.solarcharge.transport.ControlCommandSender;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Start and stop requests for a port, enforcing a single owner per port.
 *
 * <p>Each request runs as one unit of work on the coordinator worker. The store's unique
 * active-port column is the real guard against two ACTIVE sessions: the read before the
 * insert only gives a fast answer in the common case. Losing the insert race is handled
 * the same way as finding the session on the read.
 *
 * <p>The port's persisted status is written last on every branch.
 */
@Service
public class SessionControlService {

    private static final Logger log = LoggerFactory.getLogger(SessionControlService.class);

    private final CoordinatorWorker coordinatorWorker;
    private final PortDirectory portDirectory;
    private final PortStatusService portStatusService;
    private final ChargingSessionStore chargingSessionStore;
    private final ChargingCoordinator chargingCoordinator;
    private final SessionTerminator sessionTerminator;
    private final ControlCommandSender controlCommandSender;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public SessionControlService(
            CoordinatorWorker coordinatorWorker,
            PortDirectory portDirectory,
            PortStatusService portStatusService,
            ChargingSessionStore chargingSessionStore,
            ChargingCoordinator chargingCoordinator,
            SessionTerminator sessionTerminator,
            ControlCommandSender controlCommandSender,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.coordinatorWorker = coordinatorWorker;
        this.portDirectory = portDirectory;
        this.portStatusService = portStatusService;
        this.chargingSessionStore = chargingSessionStore;
        this.chargingCoordinator = chargingCoordinator;
        this.sessionTerminator = sessionTerminator;
        this.controlCommandSender = controlCommandSender;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Starts a session on the port, or resumes the caller's own ACTIVE session.
     *
     * @param stationId optional; defaults to the port's station
     * @throws com.solarcharge.exception.PortNotFoundException if the port is not mapped
     * @throws PortOccupiedException if another user's session is ACTIVE on the port
     */
    public ControlResult start(String deviceId, int portNumber, String userId, String stationId) {
        return coordinatorWorker.call(() -> doStart(deviceId, portNumber, userId, stationId));
    }

    /**
     * Stops the caller's session on the port. With no ACTIVE session the port is still
     * turned off and the result carries no session id.
     *
     * @throws NotSessionOwnerException if the ACTIVE session belongs to another user
     */
    public ControlResult stop(String deviceId, int portNumber, String userId) {
        return coordinatorWorker.call(() -> doStop(deviceId, portNumber, userId));
    }

    public ControlResult control(
            String deviceId, int portNumber, ControlCommand command, String userId, String stationId) {
        return command == ControlCommand.ON
                ? start(deviceId, portNumber, userId, stationId)
                : stop(deviceId, portNumber, userId);
    }

    ControlResult doStart(String deviceId, int portNumber, String userId, String stationId) {
        ResolvedPort port = portDirectory.resolvePort(deviceId, portNumber);
        SessionKey key = SessionKey.of(deviceId, portNumber);
        LocalDateTime now = LocalDateTime.now(clock);

        ChargingSession session;
        boolean resumed;
        Optional<ChargingSession> existing = chargingSessionStore.findActiveByPort(port.getPortId());
        if (existing.isPresent()) {
            session = requireOwnedBy(existing.get(), userId, port);
            resumed = true;
        } else {
            ChargingSession created;
            try {
                created = chargingSessionStore.create(newSession(port, userId, stationId, now));
            } catch (DataIntegrityViolationException e) {
                log.info("Concurrent start on port {}, re-reading the winning session", port.getPortId());
                created = null;
            }
            if (created != null) {
                session = created;
                resumed = false;
            } else {
                ChargingSession winner = chargingSessionStore
                        .findActiveByPort(port.getPortId())
                        .orElseThrow(() -> new TransientIoException(
                                "Session insert conflicted on port " + port.getPortId() + " but no ACTIVE session found"));
                session = requireOwnedBy(winner, userId, port);
                resumed = true;
            }
        }

        if (resumed) {
            chargingSessionStore.touch(session.getId(), now);
            log.info("Session resumed: sessionId={}, userId={}, key={}", session.getId(), userId, key);
            eventPublisherHelper.publishSessionResumed(this, session, deviceId, portNumber);
        } else {
            log.info(
                    "Session started: sessionId={}, userId={}, key={}, portId={}, premium={}",
                    session.getId(),
                    userId,
                    key,
                    port.getPortId(),
                    port.isPremium());
            eventPublisherHelper.publishSessionStarted(this, session, deviceId, portNumber);
        }
        chargingCoordinator.track(key, session.getId());

        PortStatus status = PortStatusMapper.forCommand(ControlCommand.ON, port.isPremium());
        boolean published = controlCommandSender.send(deviceId, portNumber, ControlCommand.ON);
        portStatusService.applyStatus(port.getPortId(), status);

        return ControlResult.builder()
                .deviceId(deviceId)
                .portNumber(portNumber)
                .command(ControlCommand.ON)
                .sessionId(session.getId())
                .resumed(resumed)
                .portStatus(status)
                .commandPublished(published)
                .build();
    }

    ControlResult doStop(String deviceId, int portNumber, String userId) {
        ResolvedPort port = portDirectory.resolvePort(deviceId, portNumber);
        SessionKey key = SessionKey.of(deviceId, portNumber);
        PortStatus status = PortStatusMapper.forCommand(ControlCommand.OFF, port.isPremium());

        Optional<ChargingSession> active = chargingSessionStore.findActiveByPort(port.getPortId());
        String sessionId = null;
        if (active.isEmpty()) {
            log.info("Stop with no ACTIVE session, turning port off anyway: key={}, userId={}", key, userId);
            chargingCoordinator.release(key);
            eventPublisherHelper.publishStopWithoutSession(this, userId, deviceId, portNumber);
        } else {
            ChargingSession session = active.get();
            if (!session.getUserId().equals(userId)) {
                throw new NotSessionOwnerException(session.getId(), userId);
            }
            sessionTerminator.complete(session, SessionCloseReason.USER_STOP, deviceId, portNumber);
            chargingCoordinator.release(key);
            sessionId = session.getId();
        }

        boolean published = controlCommandSender.send(deviceId, portNumber, ControlCommand.OFF);
        portStatusService.applyStatus(port.getPortId(), status);

        return ControlResult.builder()
                .deviceId(deviceId)
                .portNumber(portNumber)
                .command(ControlCommand.OFF)
                .sessionId(sessionId)
                .resumed(false)
                .portStatus(status)
                .commandPublished(published)
                .build();
    }

    private static ChargingSession requireOwnedBy(ChargingSession session, String userId, ResolvedPort port) {
        if (!session.getUserId().equals(userId)) {
            log.warn(
                    "Start rejected, port occupied: portId={}, owner={}, requester={}",
                    port.getPortId(),
                    session.getUserId(),
                    userId);
            throw new PortOccupiedException(port.getPortId());
        }
        return session;
    }

    private static ChargingSession newSession(
            ResolvedPort port, String userId, String stationId, LocalDateTime now) {
        return ChargingSession.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .portId(port.getPortId())
                .stationId(stationId != null && !stationId.isBlank() ? stationId : port.getStationId())
                .startTime(now)
                .status(SessionStatus.ACTIVE)
                .energyKwh(0)
                .chargeMah(0)
                .cost(BigDecimal.ZERO)
                .lastActivity(now)
                .premium(port.isPremium())
                .build();
    }
}
