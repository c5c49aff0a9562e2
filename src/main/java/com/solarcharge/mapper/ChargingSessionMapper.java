package com.solarcharge.mapper;

import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.entity.ChargingSessionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between ChargingSession domain model and ChargingSessionEntity.
 *
 * <p>{@code activePortId} is a store-level guard column and is not part of the domain;
 * it is set explicitly when a session row is created.
 */
@Mapper
public interface ChargingSessionMapper {

    @Mapping(target = "activePortId", ignore = true)
    ChargingSessionEntity toEntity(ChargingSession session);

    ChargingSession toDomain(ChargingSessionEntity entity);

    List<ChargingSession> toDomainList(List<ChargingSessionEntity> entities);
}
