package com.solarcharge.port;

import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;

/**
 * Derives a {@link PortStatus} from what a device reports or what the coordinator commands.
 * The only place port status is computed.
 */
public final class PortStatusMapper {

    private PortStatusMapper() {}

    /**
     * Precedence: offline connectivity, then charger ON (premium-aware), then AVAILABLE.
     */
    public static PortStatus fromTelemetry(String connectivity, ChargerState chargerState, boolean premium) {
        if ("offline".equalsIgnoreCase(connectivity)) {
            return PortStatus.OFFLINE;
        }
        if (chargerState == ChargerState.ON) {
            return charging(premium);
        }
        return PortStatus.AVAILABLE;
    }

    public static PortStatus forCommand(ControlCommand command, boolean premium) {
        return command == ControlCommand.ON ? charging(premium) : PortStatus.AVAILABLE;
    }

    private static PortStatus charging(boolean premium) {
        return premium ? PortStatus.CHARGING_PREMIUM : PortStatus.CHARGING_FREE;
    }
}
