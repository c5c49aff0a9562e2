package com.solarcharge.repository.jpa;

import com.solarcharge.entity.DeviceStatusLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeviceStatusLogJpaRepository extends JpaRepository<DeviceStatusLogEntity, Long> {

    List<DeviceStatusLogEntity> findByPortIdOrderByTimestampDesc(String portId);
}
