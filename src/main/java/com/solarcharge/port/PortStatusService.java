package com.solarcharge.port;

import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.domain.model.StatusTelemetry;
import com.solarcharge.entity.CurrentDeviceStatusEntity;
import com.solarcharge.entity.DeviceStatusLogEntity;
import com.solarcharge.repository.jpa.ChargingPortJpaRepository;
import com.solarcharge.repository.jpa.CurrentDeviceStatusJpaRepository;
import com.solarcharge.repository.jpa.DeviceStatusLogJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes port status: the status/occupied projection on the port row, and for device
 * status messages also the status log and the current-status upsert.
 */
@Service
public class PortStatusService {

    private static final Logger log = LoggerFactory.getLogger(PortStatusService.class);

    private final ChargingPortJpaRepository chargingPortJpaRepository;
    private final DeviceStatusLogJpaRepository deviceStatusLogJpaRepository;
    private final CurrentDeviceStatusJpaRepository currentDeviceStatusJpaRepository;
    private final Clock clock;

    public PortStatusService(
            ChargingPortJpaRepository chargingPortJpaRepository,
            DeviceStatusLogJpaRepository deviceStatusLogJpaRepository,
            CurrentDeviceStatusJpaRepository currentDeviceStatusJpaRepository,
            Clock clock) {
        this.chargingPortJpaRepository = chargingPortJpaRepository;
        this.deviceStatusLogJpaRepository = deviceStatusLogJpaRepository;
        this.currentDeviceStatusJpaRepository = currentDeviceStatusJpaRepository;
        this.clock = clock;
    }

    /** Sets status, derives occupied from it, stamps the current time. */
    public void applyStatus(String portId, PortStatus status) {
        applyStatus(portId, status, LocalDateTime.now(clock));
    }

    /** As {@link #applyStatus(String, PortStatus)}, stamped with {@code at}. */
    public void applyStatus(String portId, PortStatus status, LocalDateTime at) {
        int updated = chargingPortJpaRepository.updateStatus(portId, status, status.isOccupied(), at);
        if (updated == 0) {
            log.warn("Port status not applied, port row missing: portId={}, status={}", portId, status);
        } else {
            log.debug("Port status applied: portId={}, status={}", portId, status);
        }
    }

    /**
     * Handles a per-port status message: log row, current-status upsert, then port status.
     * All three carry the device-reported time, or the receive time when the device sent none.
     *
     * @return the status derived for the port
     */
    @Transactional
    public PortStatus recordDeviceStatus(StatusTelemetry telemetry, ResolvedPort port) {
        PortStatus status = PortStatusMapper.fromTelemetry(
                telemetry.getConnectivity(), telemetry.getChargerState(), port.isPremium());
        LocalDateTime reportedAt =
                telemetry.getTimestamp() != null ? telemetry.getTimestamp() : LocalDateTime.now(clock);
        String statusMessage = telemetry.getConnectivity() != null ? telemetry.getConnectivity() : "unknown";

        deviceStatusLogJpaRepository.save(DeviceStatusLogEntity.builder()
                .deviceId(telemetry.getDeviceId())
                .portId(port.getPortId())
                .statusMessage(statusMessage)
                .chargerState(telemetry.getChargerState())
                .timestamp(reportedAt)
                .build());

        currentDeviceStatusJpaRepository.save(CurrentDeviceStatusEntity.builder()
                .deviceId(telemetry.getDeviceId())
                .portId(port.getPortId())
                .statusMessage(statusMessage)
                .chargerState(telemetry.getChargerState())
                .lastUpdate(reportedAt)
                .build());

        applyStatus(port.getPortId(), status, reportedAt);

        log.info(
                "Device status recorded: deviceId={}, port={}, connectivity={}, charger={}, status={}",
                telemetry.getDeviceId(),
                port.getDeviceIndex(),
                statusMessage,
                telemetry.getChargerState(),
                status);
        return status;
    }
}
