package com.solarcharge.repository.jpa;

import com.solarcharge.entity.ConsumptionDataEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the consumption_data table.
 */
@Repository
public interface ConsumptionDataJpaRepository extends JpaRepository<ConsumptionDataEntity, Long> {

    List<ConsumptionDataEntity> findBySessionIdOrderByTimestampAsc(String sessionId);

    /** Latest samples reported by a device for any session that ran on the given port. */
    @Query("SELECT c FROM ConsumptionDataEntity c WHERE c.deviceId = :deviceId AND c.sessionId IN "
            + "(SELECT s.id FROM ChargingSessionEntity s WHERE s.portId = :portId) ORDER BY c.timestamp DESC")
    List<ConsumptionDataEntity> findRecentForPort(
            @Param("deviceId") String deviceId, @Param("portId") String portId, Pageable pageable);
}
