package com.solarcharge.entity;

import com.solarcharge.domain.enums.ChargerState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the current_device_status table: the latest status per (device, port),
 * upserted on every status message.
 */
@Entity
@Table(name = "current_device_status")
@IdClass(CurrentDeviceStatusId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrentDeviceStatusEntity {

    @Id
    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Id
    @Column(name = "port_id", length = 36)
    private String portId;

    @Column(name = "status_message", length = 50)
    private String statusMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "charger_state", columnDefinition = "varchar(10)")
    private ChargerState chargerState;

    @Column(name = "last_update", nullable = false)
    private LocalDateTime lastUpdate;
}
