package com.solarcharge.entity;

import com.solarcharge.domain.enums.ChargerState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the device_status_logs table.
 * Append-only history of every status message received for a resolved port.
 */
@Entity
@Table(name = "device_status_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceStatusLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", length = 100, nullable = false)
    private String deviceId;

    @Column(name = "port_id", length = 36)
    private String portId;

    @Column(name = "status_message", length = 50)
    private String statusMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "charger_state", columnDefinition = "varchar(10)")
    private ChargerState chargerState;

    @Column(nullable = false)
    private LocalDateTime timestamp;
}
