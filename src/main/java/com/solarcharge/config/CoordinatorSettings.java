package com.solarcharge.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed accounting and timing constants of the session coordinator.
 * Built once from {@code solarcharge.session.*} and {@code solarcharge.pricing.*}.
 */
@Value
@Builder
public class CoordinatorSettings {

    Duration inactivityTimeout;

    /** Expected telemetry cadence; each accepted sample accounts for this much time. */
    int sampleIntervalSeconds;

    double nominalVoltage;
    double maxConsumptionWatts;
    BigDecimal defaultPricePerKwh;

    /** Sessions idle longer than this are swept by the reconciler. */
    public Duration staleAfter() {
        return inactivityTimeout.multipliedBy(2);
    }
}
