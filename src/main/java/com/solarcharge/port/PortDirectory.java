package com.solarcharge.port;

import com.solarcharge.domain.model.ChargingPort;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.exception.PortNotFoundException;
import com.solarcharge.mapper.ChargingPortMapper;
import com.solarcharge.repository.jpa.ChargingPortJpaRepository;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Resolves a (device, physical index) pair to the durable port it drives.
 *
 * <p>Port mappings change only at provisioning time, so successful lookups are cached
 * in the "ports" cache. A missing mapping is a configuration fact: callers drop the
 * triggering event instead of retrying.
 */
@Service
public class PortDirectory {

    private final ChargingPortJpaRepository chargingPortJpaRepository;
    private final ChargingPortMapper chargingPortMapper = Mappers.getMapper(ChargingPortMapper.class);

    public PortDirectory(ChargingPortJpaRepository chargingPortJpaRepository) {
        this.chargingPortJpaRepository = chargingPortJpaRepository;
    }

    /**
     * @throws PortNotFoundException if the device id is blank, the index is below 1,
     *     or no port row matches
     */
    @Cacheable(cacheNames = "ports", key = "#deviceId + '_' + #deviceIndex")
    public ResolvedPort resolvePort(String deviceId, Integer deviceIndex) {
        if (deviceId == null || deviceId.isBlank() || deviceIndex == null || deviceIndex < 1) {
            throw new PortNotFoundException(deviceId, deviceIndex);
        }
        return chargingPortJpaRepository
                .findByDeviceIdAndDeviceIndex(deviceId, deviceIndex)
                .map(chargingPortMapper::toResolved)
                .orElseThrow(() -> new PortNotFoundException(deviceId, deviceIndex));
    }

    public Optional<ChargingPort> findPort(String portId) {
        return chargingPortJpaRepository.findById(portId).map(chargingPortMapper::toDomain);
    }
}
