package com.solarcharge.pricing;

import com.solarcharge.config.CoordinatorSettings;
import com.solarcharge.entity.ChargingSessionEntity;
import com.solarcharge.entity.ChargingStationEntity;
import com.solarcharge.repository.jpa.ChargingSessionJpaRepository;
import com.solarcharge.repository.jpa.ChargingStationJpaRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prices a session's energy at its station's rate, or the default rate when the station
 * has none configured.
 *
 * <p>Best-effort: an unresolvable session or station yields zero and an error log, never
 * an exception, so closing a session is never blocked by pricing.
 */
@Service
public class CostCalculator {

    private static final Logger log = LoggerFactory.getLogger(CostCalculator.class);

    static final int COST_SCALE = 4;

    private final ChargingSessionJpaRepository chargingSessionJpaRepository;
    private final ChargingStationJpaRepository chargingStationJpaRepository;
    private final BigDecimal defaultPricePerKwh;

    public CostCalculator(
            ChargingSessionJpaRepository chargingSessionJpaRepository,
            ChargingStationJpaRepository chargingStationJpaRepository,
            CoordinatorSettings coordinatorSettings) {
        this.chargingSessionJpaRepository = chargingSessionJpaRepository;
        this.chargingStationJpaRepository = chargingStationJpaRepository;
        this.defaultPricePerKwh = coordinatorSettings.getDefaultPricePerKwh();
    }

    public BigDecimal cost(String sessionId, double energyKwh) {
        try {
            Optional<String> stationId =
                    chargingSessionJpaRepository.findById(sessionId).map(ChargingSessionEntity::getStationId);
            if (stationId.isEmpty()) {
                log.error("Cost not computed, session not found: sessionId={}", sessionId);
                return zero();
            }
            Optional<ChargingStationEntity> station = chargingStationJpaRepository.findById(stationId.get());
            if (station.isEmpty()) {
                log.error(
                        "Cost not computed, station not found: sessionId={}, stationId={}",
                        sessionId,
                        stationId.get());
                return zero();
            }
            BigDecimal price = station.get().getPricePerKwh() != null
                    ? station.get().getPricePerKwh()
                    : defaultPricePerKwh;
            return price.multiply(BigDecimal.valueOf(energyKwh)).setScale(COST_SCALE, RoundingMode.HALF_UP);
        } catch (RuntimeException e) {
            log.error("Cost calculation failed: sessionId={}, energyKwh={}", sessionId, energyKwh, e);
            return zero();
        }
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(COST_SCALE);
    }
}
