package com.solarcharge.repository.jpa;

import com.solarcharge.entity.CurrentDeviceStatusEntity;
import com.solarcharge.entity.CurrentDeviceStatusId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for current_device_status. {@code save} on an existing (device, port)
 * key is the upsert.
 */
@Repository
public interface CurrentDeviceStatusJpaRepository
        extends JpaRepository<CurrentDeviceStatusEntity, CurrentDeviceStatusId> {}
