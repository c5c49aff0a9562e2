package com.solarcharge.entity;

import com.solarcharge.domain.enums.PortStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the charging_port table.
 * (device_mqtt_id, port_number_in_device) is unique: it is the directory key used to
 * resolve telemetry and control requests to a durable port.
 */
@Entity
@Table(
        name = "charging_port",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_charging_port_device_index",
                columnNames = {"device_mqtt_id", "port_number_in_device"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChargingPortEntity {

    @Id
    @Column(name = "port_id", length = 36)
    private String id;

    @Column(name = "station_id", length = 36, nullable = false)
    private String stationId;

    @Column(name = "device_mqtt_id", length = 100)
    private String deviceId;

    @Column(name = "port_number_in_device")
    private Integer deviceIndex;

    @Column(name = "is_premium", nullable = false)
    private boolean premium;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_status", columnDefinition = "varchar(30)")
    private PortStatus status;

    @Column(name = "is_occupied")
    private boolean occupied;

    @Column(name = "last_status_update")
    private LocalDateTime lastStatusUpdate;
}
