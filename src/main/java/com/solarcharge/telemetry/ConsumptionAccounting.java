package com.solarcharge.telemetry;

import com.solarcharge.config.CoordinatorSettings;
import org.springframework.stereotype.Component;

/**
 * Consumption clamping and per-sample energy/charge increments. Each accepted sample
 * stands for one sample interval of charging at the reported wattage.
 */
@Component
public class ConsumptionAccounting {

    private final double maxConsumptionWatts;
    private final int sampleIntervalSeconds;
    private final double nominalVoltage;

    public ConsumptionAccounting(CoordinatorSettings coordinatorSettings) {
        this.maxConsumptionWatts = coordinatorSettings.getMaxConsumptionWatts();
        this.sampleIntervalSeconds = coordinatorSettings.getSampleIntervalSeconds();
        this.nominalVoltage = coordinatorSettings.getNominalVoltage();
    }

    /** Missing, NaN or negative readings become 0; readings above the ceiling are capped. */
    public double validateConsumption(Double watts) {
        if (watts == null || watts.isNaN() || watts < 0) {
            return 0;
        }
        return Math.min(watts, maxConsumptionWatts);
    }

    /** kWh = W * s / 3,600,000 */
    public double energyIncrementKwh(double watts) {
        return watts * sampleIntervalSeconds / 3_600_000d;
    }

    /** mAh = (W / V) * 1000 * s / 3600 */
    public double chargeIncrementMah(double watts) {
        return (watts / nominalVoltage) * 1000 * sampleIntervalSeconds / 3600d;
    }
}
