package com.solarcharge.mapper;

import com.solarcharge.domain.model.ConsumptionSample;
import com.solarcharge.entity.ConsumptionDataEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ConsumptionSampleMapper {

    ConsumptionDataEntity toEntity(ConsumptionSample sample);

    ConsumptionSample toDomain(ConsumptionDataEntity entity);

    List<ConsumptionSample> toDomainList(List<ConsumptionDataEntity> entities);
}
