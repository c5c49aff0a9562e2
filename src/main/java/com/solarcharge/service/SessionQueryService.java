package com.solarcharge.service;

import com.solarcharge.api.dto.response.ActiveSessionResponse;
import com.solarcharge.api.dto.response.ConsumptionPointResponse;
import com.solarcharge.api.dto.response.DeviceStatusResponse;
import com.solarcharge.api.dto.response.SessionConsumptionResponse;
import com.solarcharge.domain.model.ChargingPort;
import com.solarcharge.domain.model.ChargingSession;
import com.solarcharge.domain.model.ConsumptionSample;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.entity.ConsumptionDataEntity;
import com.solarcharge.entity.CurrentDeviceStatusEntity;
import com.solarcharge.exception.ResourceNotFoundException;
import com.solarcharge.port.PortDirectory;
import com.solarcharge.repository.jpa.ConsumptionDataJpaRepository;
import com.solarcharge.repository.jpa.CurrentDeviceStatusJpaRepository;
import com.solarcharge.session.ChargingSessionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Read-only views over sessions, samples and device status for the REST layer.
 * Reads the store directly; never goes through the coordinator worker.
 */
@Service
public class SessionQueryService {

    static final int PORT_CONSUMPTION_LIMIT = 100;

    private final ChargingSessionStore chargingSessionStore;
    private final PortDirectory portDirectory;
    private final ConsumptionDataJpaRepository consumptionDataJpaRepository;
    private final CurrentDeviceStatusJpaRepository currentDeviceStatusJpaRepository;
    private final Clock clock;

    public SessionQueryService(
            ChargingSessionStore chargingSessionStore,
            PortDirectory portDirectory,
            ConsumptionDataJpaRepository consumptionDataJpaRepository,
            CurrentDeviceStatusJpaRepository currentDeviceStatusJpaRepository,
            Clock clock) {
        this.chargingSessionStore = chargingSessionStore;
        this.portDirectory = portDirectory;
        this.consumptionDataJpaRepository = consumptionDataJpaRepository;
        this.currentDeviceStatusJpaRepository = currentDeviceStatusJpaRepository;
        this.clock = clock;
    }

    public List<ActiveSessionResponse> activeSessions() {
        LocalDateTime now = LocalDateTime.now(clock);
        return chargingSessionStore.findActive().stream()
                .map(session -> {
                    Optional<ChargingPort> port = portDirectory.findPort(session.getPortId());
                    return ActiveSessionResponse.builder()
                            .sessionId(session.getId())
                            .userId(session.getUserId())
                            .portId(session.getPortId())
                            .stationId(session.getStationId())
                            .deviceId(port.map(ChargingPort::getDeviceId).orElse(null))
                            .portNumber(port.map(ChargingPort::getDeviceIndex).orElse(null))
                            .premium(session.isPremium())
                            .startTime(session.getStartTime())
                            .lastActivity(session.getLastActivity())
                            .energyKwh(session.getEnergyKwh())
                            .chargeMah(session.getChargeMah())
                            .durationMinutes(Duration.between(session.getStartTime(), now).toMinutes())
                            .build();
                })
                .toList();
    }

    public SessionConsumptionResponse sessionConsumption(String sessionId) {
        ChargingSession session = chargingSessionStore
                .findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        List<ConsumptionSample> samples = chargingSessionStore.findSamples(sessionId);

        LocalDateTime end = session.getEndTime() != null ? session.getEndTime() : LocalDateTime.now(clock);
        double averageWatts = samples.stream()
                .mapToDouble(ConsumptionSample::getWatts)
                .average()
                .orElse(0);

        return SessionConsumptionResponse.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .status(session.getStatus())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .durationMinutes(Duration.between(session.getStartTime(), end).toMinutes())
                .energyKwh(session.getEnergyKwh())
                .chargeMah(session.getChargeMah())
                .cost(session.getCost())
                .averageWatts(averageWatts)
                .sampleCount(samples.size())
                .samples(samples.stream().map(SessionQueryService::toPoint).toList())
                .build();
    }

    /**
     * Latest samples for any session on the port, oldest first.
     *
     * @throws com.solarcharge.exception.PortNotFoundException if the port is not mapped
     */
    public List<ConsumptionPointResponse> portConsumption(String deviceId, int portNumber) {
        ResolvedPort port = portDirectory.resolvePort(deviceId, portNumber);
        List<ConsumptionDataEntity> recent = consumptionDataJpaRepository.findRecentForPort(
                deviceId, port.getPortId(), PageRequest.of(0, PORT_CONSUMPTION_LIMIT));
        return recent.stream()
                .sorted(Comparator.comparing(ConsumptionDataEntity::getTimestamp))
                .map(entity -> ConsumptionPointResponse.builder()
                        .sessionId(entity.getSessionId())
                        .timestamp(entity.getTimestamp())
                        .watts(entity.getWatts())
                        .chargerState(entity.getChargerState())
                        .build())
                .toList();
    }

    public List<DeviceStatusResponse> deviceStatuses() {
        return currentDeviceStatusJpaRepository.findAll().stream()
                .map(this::toDeviceStatus)
                .sorted(Comparator.comparing(DeviceStatusResponse::getDeviceId)
                        .thenComparing(r -> r.getPortNumber() != null ? r.getPortNumber() : Integer.MAX_VALUE))
                .toList();
    }

    private DeviceStatusResponse toDeviceStatus(CurrentDeviceStatusEntity status) {
        Optional<ChargingPort> port = portDirectory.findPort(status.getPortId());
        Optional<ChargingSession> active = chargingSessionStore.findActiveByPort(status.getPortId());
        return DeviceStatusResponse.builder()
                .deviceId(status.getDeviceId())
                .portId(status.getPortId())
                .portNumber(port.map(ChargingPort::getDeviceIndex).orElse(null))
                .statusMessage(status.getStatusMessage())
                .chargerState(status.getChargerState())
                .portStatus(port.map(ChargingPort::getStatus).orElse(null))
                .lastUpdate(status.getLastUpdate())
                .activeSessionId(active.map(ChargingSession::getId).orElse(null))
                .energyKwh(active.map(ChargingSession::getEnergyKwh).orElse(null))
                .chargeMah(active.map(ChargingSession::getChargeMah).orElse(null))
                .build();
    }

    private static ConsumptionPointResponse toPoint(ConsumptionSample sample) {
        return ConsumptionPointResponse.builder()
                .sessionId(sample.getSessionId())
                .timestamp(sample.getTimestamp())
                .watts(sample.getWatts())
                .chargerState(sample.getChargerState())
                .build();
    }
}
