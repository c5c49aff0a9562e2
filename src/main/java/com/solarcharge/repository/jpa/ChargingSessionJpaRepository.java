package com.solarcharge.repository.jpa;

import com.solarcharge.domain.enums.SessionStatus;
import com.solarcharge.entity.ChargingSessionEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the charging_session table.
 *
 * <p>State transitions are single conditional UPDATE statements guarded by
 * {@code status = :active}. Callers check the affected row count: 0 means another path
 * already completed the session.
 */
@Repository
public interface ChargingSessionJpaRepository extends JpaRepository<ChargingSessionEntity, String> {

    Optional<ChargingSessionEntity> findFirstByPortIdAndStatus(String portId, SessionStatus status);

    List<ChargingSessionEntity> findByStatusOrderByStartTimeDesc(SessionStatus status);

    List<ChargingSessionEntity> findByPortIdInAndStatus(List<String> portIds, SessionStatus status);

    /** ACTIVE sessions whose last activity predates the cutoff. A missing timestamp counts as idle. */
    @Query("SELECT s FROM ChargingSessionEntity s WHERE s.status = :status "
            + "AND (s.lastActivity IS NULL OR s.lastActivity < :cutoff) ORDER BY s.lastActivity ASC")
    List<ChargingSessionEntity> findIdleBefore(
            @Param("status") SessionStatus status, @Param("cutoff") LocalDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChargingSessionEntity s SET s.energyKwh = s.energyKwh + :kwh, s.chargeMah = s.chargeMah + :mah, "
            + "s.lastActivity = :at WHERE s.id = :id AND s.status = :status")
    int addConsumption(
            @Param("id") String id,
            @Param("kwh") double kwh,
            @Param("mah") double mah,
            @Param("at") LocalDateTime at,
            @Param("status") SessionStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChargingSessionEntity s SET s.lastActivity = :at WHERE s.id = :id AND s.status = :status")
    int touch(@Param("id") String id, @Param("at") LocalDateTime at, @Param("status") SessionStatus status);

    /** ACTIVE -> COMPLETED. Releases the active-port slot in the same statement. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ChargingSessionEntity s SET s.status = :completed, s.endTime = :endTime, s.lastActivity = :endTime, "
            + "s.cost = :cost, s.activePortId = NULL WHERE s.id = :id AND s.status = :active")
    int completeIfActive(
            @Param("id") String id,
            @Param("cost") BigDecimal cost,
            @Param("endTime") LocalDateTime endTime,
            @Param("active") SessionStatus active,
            @Param("completed") SessionStatus completed);
}
