package com.solarcharge.session;

import com.solarcharge.domain.enums.SessionStatus;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.ConsumptionSample;
import com.solarcharge.entity.ChargingSessionEntity;
import com.solarcharge.mapper.ChargingSessionMapper;
import com.solarcharge.mapper.ConsumptionSampleMapper;
import com.solarcharge.repository.jpa.ChargingSessionJpaRepository;
import com.solarcharge.repository.jpa.ConsumptionDataJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session persistence used by the coordinator. Every mutation is a single transaction
 * guarded by {@code status = ACTIVE}; a {@code false} return means the session was
 * no longer ACTIVE and nothing was written.
 */
@Service
public class ChargingSessionStore {

    private final ChargingSessionJpaRepository chargingSessionJpaRepository;
    private final ConsumptionDataJpaRepository consumptionDataJpaRepository;
    private final ChargingSessionMapper chargingSessionMapper = Mappers.getMapper(ChargingSessionMapper.class);
    private final ConsumptionSampleMapper consumptionSampleMapper = Mappers.getMapper(ConsumptionSampleMapper.class);

    public ChargingSessionStore(
            ChargingSessionJpaRepository chargingSessionJpaRepository,
            ConsumptionDataJpaRepository consumptionDataJpaRepository) {
        this.chargingSessionJpaRepository = chargingSessionJpaRepository;
        this.consumptionDataJpaRepository = consumptionDataJpaRepository;
    }

    public Optional<ChargingSession> findById(String sessionId) {
        return chargingSessionJpaRepository.findById(sessionId).map(chargingSessionMapper::toDomain);
    }

    public Optional<ChargingSession> findActiveByPort(String portId) {
        return chargingSessionJpaRepository
                .findFirstByPortIdAndStatus(portId, SessionStatus.ACTIVE)
                .map(chargingSessionMapper::toDomain);
    }

    public List<ChargingSession> findActive() {
        return chargingSessionMapper.toDomainList(
                chargingSessionJpaRepository.findByStatusOrderByStartTimeDesc(SessionStatus.ACTIVE));
    }

    /** ACTIVE sessions with no activity since {@code cutoff}, oldest first. */
    public List<ChargingSession> findIdleBefore(LocalDateTime cutoff) {
        return chargingSessionMapper.toDomainList(
                chargingSessionJpaRepository.findIdleBefore(SessionStatus.ACTIVE, cutoff));
    }

    /**
     * Inserts a new ACTIVE session and claims the port's active slot.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the port already
     *     has an ACTIVE session
     */
    @Transactional
    public ChargingSession create(ChargingSession session) {
        ChargingSessionEntity entity = chargingSessionMapper.toEntity(session);
        entity.setActivePortId(session.getPortId());
        return chargingSessionMapper.toDomain(chargingSessionJpaRepository.saveAndFlush(entity));
    }

    @Transactional
    public boolean touch(String sessionId, LocalDateTime at) {
        return chargingSessionJpaRepository.touch(sessionId, at, SessionStatus.ACTIVE) > 0;
    }

    /**
     * Adds the increments to the session and stores the sample, atomically. The sample is
     * only inserted when the session was still ACTIVE.
     */
    @Transactional
    public boolean recordConsumption(ConsumptionSample sample, double kwh, double mah, LocalDateTime at) {
        int updated =
                chargingSessionJpaRepository.addConsumption(sample.getSessionId(), kwh, mah, at, SessionStatus.ACTIVE);
        if (updated == 0) {
            return false;
        }
        consumptionDataJpaRepository.save(consumptionSampleMapper.toEntity(sample));
        return true;
    }

    @Transactional
    public boolean completeIfActive(String sessionId, BigDecimal cost, LocalDateTime endTime) {
        return chargingSessionJpaRepository.completeIfActive(
                        sessionId, cost, endTime, SessionStatus.ACTIVE, SessionStatus.COMPLETED)
                > 0;
    }

    public List<ConsumptionSample> findSamples(String sessionId) {
        return consumptionSampleMapper.toDomainList(
                consumptionDataJpaRepository.findBySessionIdOrderByTimestampAsc(sessionId));
    }
}
