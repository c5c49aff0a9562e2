package com.solarcharge.repository.jpa;

import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.entity.ChargingPortEntity;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the charging_port table.
 * Ports are provisioned elsewhere; this service resolves them and updates status fields only.
 */
@Repository
public interface ChargingPortJpaRepository extends JpaRepository<ChargingPortEntity, String> {

    Optional<ChargingPortEntity> findByDeviceIdAndDeviceIndex(String deviceId, Integer deviceIndex);

    /** Update only the status projection; premium and mapping columns are never touched. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE ChargingPortEntity p SET p.status = :status, p.occupied = :occupied, "
            + "p.lastStatusUpdate = :at WHERE p.id = :id")
    int updateStatus(
            @Param("id") String id,
            @Param("status") PortStatus status,
            @Param("occupied") boolean occupied,
            @Param("at") LocalDateTime at);
}
