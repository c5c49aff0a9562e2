package com.solarcharge.entity;

import com.solarcharge.domain.enums.SessionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the charging_session table.
 *
 * <p>{@code active_port_id} holds the port id while the session is ACTIVE and is cleared
 * on completion. Its unique constraint makes "one ACTIVE session per port" a property of
 * the store: a second concurrent insert for the same port fails instead of racing past
 * the read-side check. NULLs do not collide, so any number of COMPLETED rows may share a port.
 */
@Entity
@Table(
        name = "charging_session",
        uniqueConstraints = @UniqueConstraint(name = "uk_charging_session_active_port", columnNames = "active_port_id"),
        indexes = {
            @Index(name = "idx_charging_session_port_status", columnList = "port_id, session_status"),
            @Index(name = "idx_charging_session_status_activity", columnList = "session_status, last_status_update")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChargingSessionEntity {

    @Id
    @Column(name = "session_id", length = 36)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "port_id", length = 36, nullable = false)
    private String portId;

    @Column(name = "station_id", length = 36, nullable = false)
    private String stationId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_status", columnDefinition = "varchar(20)", nullable = false)
    private SessionStatus status;

    @Column(name = "energy_consumed_kwh")
    private double energyKwh;

    @Column(name = "total_mah_consumed")
    private double chargeMah;

    @Column(precision = 12, scale = 4)
    private BigDecimal cost;

    @Column(name = "last_status_update")
    private LocalDateTime lastActivity;

    @Column(name = "is_premium", nullable = false)
    private boolean premium;

    @Column(name = "active_port_id", length = 36)
    private String activePortId;
}
