package com.solarcharge.entity;

import com.solarcharge.domain.enums.ChargerState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the consumption_data table.
 * One row per accepted (positive, validated) usage sample.
 */
@Entity
@Table(name = "consumption_data", indexes = @Index(name = "idx_consumption_session", columnList = "session_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsumptionDataEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Column(name = "device_id", length = 100, nullable = false)
    private String deviceId;

    @Column(name = "port_number")
    private Integer portIndex;

    @Column(name = "consumption_watts")
    private double watts;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "charger_state", columnDefinition = "varchar(10)")
    private ChargerState chargerState;
}
