package com.solarcharge.entity;

import com.solarcharge.domain.enums.LogSource;
import com.solarcharge.domain.enums.LogType;
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
 * JPA entity for the system_logs table.
 * Operator-facing trail of coordinator events, read by the admin log viewer.
 */
@Entity
@Table(name = "system_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_type", columnDefinition = "varchar(10)", nullable = false)
    private LogType logType;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private LogSource source;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String message;

    @Column(name = "user_id", length = 36)
    private String userId;
}
