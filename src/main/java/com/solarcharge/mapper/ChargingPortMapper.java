package com.solarcharge.mapper;

import com.solarcharge.domain.model.ChargingPort;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.entity.ChargingPortEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from ChargingPortEntity to the port domain views.
 */
@Mapper
public interface ChargingPortMapper {

    ChargingPort toDomain(ChargingPortEntity entity);

    @Mapping(source = "id", target = "portId")
    ResolvedPort toResolved(ChargingPortEntity entity);
}
