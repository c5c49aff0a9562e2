package com.solarcharge.repository.jpa;

import com.solarcharge.entity.ChargingStationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChargingStationJpaRepository extends JpaRepository<ChargingStationEntity, String> {}
