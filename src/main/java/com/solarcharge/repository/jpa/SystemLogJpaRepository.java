package com.solarcharge.repository.jpa;

import com.solarcharge.domain.enums.LogType;
import com.solarcharge.entity.SystemLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SystemLogJpaRepository extends JpaRepository<SystemLogEntity, Long> {

    List<SystemLogEntity> findByLogTypeOrderByTimestampDesc(LogType logType);
}
