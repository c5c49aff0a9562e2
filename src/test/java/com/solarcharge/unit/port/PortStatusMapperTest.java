package com.solarcharge.unit.port;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarcharge.domain.enums.ChargerState;
import com.solarcharge.domain.enums.ControlCommand;
import com.solarcharge.domain.enums.PortStatus;
import com.solarcharge.port.PortStatusMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PortStatusMapperTest {

    @Nested
    @DisplayName("From telemetry")
    class FromTelemetry {

        @Test
        @DisplayName("offline wins over charger ON")
        void offlineWins() {
            assertThat(PortStatusMapper.fromTelemetry("offline", ChargerState.ON, true))
                    .isEqualTo(PortStatus.OFFLINE);
        }

        @Test
        @DisplayName("charger ON maps to premium or free charging")
        void chargerOnMapsByPremium() {
            assertThat(PortStatusMapper.fromTelemetry("online", ChargerState.ON, true))
                    .isEqualTo(PortStatus.CHARGING_PREMIUM);
            assertThat(PortStatusMapper.fromTelemetry("online", ChargerState.ON, false))
                    .isEqualTo(PortStatus.CHARGING_FREE);
        }

        @Test
        @DisplayName("charger OFF or UNKNOWN while online is AVAILABLE")
        void otherwiseAvailable() {
            assertThat(PortStatusMapper.fromTelemetry("online", ChargerState.OFF, false))
                    .isEqualTo(PortStatus.AVAILABLE);
            assertThat(PortStatusMapper.fromTelemetry(null, ChargerState.UNKNOWN, true))
                    .isEqualTo(PortStatus.AVAILABLE);
        }
    }

    @Test
    @DisplayName("commands map ON to charging and OFF to AVAILABLE")
    void forCommand() {
        assertThat(PortStatusMapper.forCommand(ControlCommand.ON, false)).isEqualTo(PortStatus.CHARGING_FREE);
        assertThat(PortStatusMapper.forCommand(ControlCommand.ON, true)).isEqualTo(PortStatus.CHARGING_PREMIUM);
        assertThat(PortStatusMapper.forCommand(ControlCommand.OFF, true)).isEqualTo(PortStatus.AVAILABLE);
        assertThat(PortStatus.CHARGING_PREMIUM.isOccupied()).isTrue();
        assertThat(PortStatus.OFFLINE.isOccupied()).isFalse();
    }
}
