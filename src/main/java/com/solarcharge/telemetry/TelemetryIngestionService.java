package com.solarcharge.telemetry;

import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.enums.TelemetryKind;
import com.solarcharge.domain.model.ConsumptionSample;
import com.solarcharge.domain.model.ResolvedPort;
import com.solarcharge.domain.model.StatusTelemetry;
import com.solarcharge.domain.model.UsageTelemetry;
import com.solarcharge.event.EventPublisherHelper;
import com.solarcharge.exception.MalformedTelemetryException;
import com.solarcharge.exception.PortNotFoundException;
import com.solarcharge.port.PortDirectory;
import com.solarcharge.port.PortStatusService;
import com.solarcharge.session.ChargingCoordinator;
import com.solarcharge.session.ChargingSessionStore;
import com.solarcharge.session.SessionKey;
import com.solarcharge.telemetry.TelemetryTopics.ParsedTopic;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Interprets one inbound message: usage samples feed session accounting, status messages
 * feed port status. Runs on the coordinator worker.
 *
 * <p>Never throws. Malformed payloads, unmapped ports and store failures drop the message
 * with a log line and a {@code DROPPED} telemetry event; redelivery is not assumed.
 */
@Service
public class TelemetryIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryIngestionService.class);

    private final TelemetryTopics telemetryTopics;
    private final TelemetryParser telemetryParser;
    private final ConsumptionAccounting consumptionAccounting;
    private final PortDirectory portDirectory;
    private final PortStatusService portStatusService;
    private final ChargingSessionStore chargingSessionStore;
    private final ChargingCoordinator chargingCoordinator;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public TelemetryIngestionService(
            TelemetryTopics telemetryTopics,
            TelemetryParser telemetryParser,
            ConsumptionAccounting consumptionAccounting,
            PortDirectory portDirectory,
            PortStatusService portStatusService,
            ChargingSessionStore chargingSessionStore,
            ChargingCoordinator chargingCoordinator,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.telemetryTopics = telemetryTopics;
        this.telemetryParser = telemetryParser;
        this.consumptionAccounting = consumptionAccounting;
        this.portDirectory = portDirectory;
        this.portStatusService = portStatusService;
        this.chargingSessionStore = chargingSessionStore;
        this.chargingCoordinator = chargingCoordinator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public void ingest(String topic, String payload) {
        ParsedTopic parsed;
        try {
            parsed = telemetryTopics.parse(topic);
        } catch (MalformedTelemetryException e) {
            log.warn("Telemetry dropped: {}", e.getMessage());
            eventPublisherHelper.publishTelemetryDropped(this, null, null, null, e.getMessage());
            return;
        }

        try {
            switch (parsed.kind()) {
                case USAGE -> handleUsage(telemetryParser.parseUsage(parsed.deviceId(), payload));
                case STATUS -> handleStatus(telemetryParser.parseStatus(parsed.deviceId(), payload));
                case STATION -> handleStation(parsed.deviceId(), payload);
            }
        } catch (MalformedTelemetryException e) {
            drop(parsed.kind(), parsed.deviceId(), null, e.getMessage());
        } catch (PortNotFoundException e) {
            drop(parsed.kind(), parsed.deviceId(), null, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Telemetry dropped, store unavailable: topic={}", topic, e);
            eventPublisherHelper.publishTelemetryDropped(
                    this, parsed.kind(), parsed.deviceId(), null, "Store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Telemetry processing failed: topic={}", topic, e);
            eventPublisherHelper.publishTelemetryDropped(
                    this, parsed.kind(), parsed.deviceId(), null, "Processing failed: " + e.getMessage());
        }
    }

    void handleUsage(UsageTelemetry usage) {
        Integer portIndex = usage.getPortIndex();
        if (portIndex == null || portIndex < 1) {
            drop(TelemetryKind.USAGE, usage.getDeviceId(), portIndex, "Usage message without a valid port_number");
            return;
        }
        ResolvedPort port = portDirectory.resolvePort(usage.getDeviceId(), portIndex);

        if (usage.getChargerState() != ChargerState.ON) {
            // Sessions end only through stop requests, timers or the reconciler
            log.debug("Usage with charger {}, no accounting: deviceId={}, port={}",
                    usage.getChargerState(), usage.getDeviceId(), portIndex);
            return;
        }

        SessionKey key = SessionKey.of(usage.getDeviceId(), portIndex);
        Optional<String> sessionId = chargingCoordinator.findOrAdopt(key, port.getPortId());
        if (sessionId.isEmpty()) {
            drop(TelemetryKind.USAGE, usage.getDeviceId(), portIndex, "Charger ON but no ACTIVE session for " + key);
            return;
        }

        double watts = consumptionAccounting.validateConsumption(usage.getConsumptionWatts());
        if (watts <= 0) {
            drop(TelemetryKind.USAGE, usage.getDeviceId(), portIndex,
                    "Non-positive consumption (" + usage.getConsumptionWatts() + "W) for " + key);
            return;
        }

        ConsumptionSample sample = ConsumptionSample.builder()
                .sessionId(sessionId.get())
                .deviceId(usage.getDeviceId())
                .portIndex(portIndex)
                .watts(watts)
                .timestamp(usage.getTimestamp())
                .chargerState(ChargerState.ON)
                .build();
        double kwh = consumptionAccounting.energyIncrementKwh(watts);
        double mah = consumptionAccounting.chargeIncrementMah(watts);

        if (!chargingSessionStore.recordConsumption(sample, kwh, mah, LocalDateTime.now(clock))) {
            chargingCoordinator.releaseSession(key, sessionId.get());
            drop(TelemetryKind.USAGE, usage.getDeviceId(), portIndex,
                    "Session " + sessionId.get() + " no longer ACTIVE");
            return;
        }

        chargingCoordinator.refreshActivity(key);
        log.debug("Consumption recorded: key={}, sessionId={}, watts={}", key, sessionId.get(), watts);
        eventPublisherHelper.publishUsageAccepted(this, usage.getDeviceId(), portIndex, watts);
    }

    void handleStatus(StatusTelemetry status) {
        Integer portIndex = status.getPortIndex();
        if (portIndex == null || portIndex < 1) {
            if (status.isStationAnnouncement()) {
                log.info("Station {} is {}", status.getDeviceId(), status.getConnectivity());
                eventPublisherHelper.publishStationAnnouncement(
                        this,
                        TelemetryKind.STATUS,
                        status.getDeviceId(),
                        "Station " + status.getDeviceId() + " is " + status.getConnectivity());
                return;
            }
            drop(TelemetryKind.STATUS, status.getDeviceId(), portIndex, "Status message without a valid port_number");
            return;
        }
        ResolvedPort port = portDirectory.resolvePort(status.getDeviceId(), portIndex);
        portStatusService.recordDeviceStatus(status, port);
    }

    void handleStation(String deviceId, String payload) {
        String detail = payload == null ? "" : TelemetryParser.abbreviate(payload);
        log.info("Generic station status: deviceId={}, payload={}", deviceId, detail);
        eventPublisherHelper.publishStationAnnouncement(this, TelemetryKind.STATION, deviceId, detail);
    }

    private void drop(TelemetryKind kind, String deviceId, Integer portIndex, String reason) {
        log.warn("Telemetry dropped: kind={}, deviceId={}, port={}, reason={}", kind, deviceId, portIndex, reason);
        eventPublisherHelper.publishTelemetryDropped(this, kind, deviceId, portIndex, reason);
    }
}
