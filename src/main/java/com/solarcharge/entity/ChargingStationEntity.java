package com.solarcharge.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the charging_station table.
 * Managed by the station administration surface; the coordinator only reads the price.
 */
@Entity
@Table(name = "charging_station")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChargingStationEntity {

    @Id
    @Column(name = "station_id", length = 36)
    private String id;

    @Column(name = "station_name", length = 200)
    private String name;

    @Column(name = "device_mqtt_id", length = 100)
    private String deviceId;

    /** Null means the default rate applies. */
    @Column(name = "price_per_kwh", precision = 12, scale = 4)
    private BigDecimal pricePerKwh;

    @Column(name = "is_active")
    private boolean active;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
