package com.example.dbjobs.entity;

import com.example.dbjobs.enums.HealthStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 健康检查流水，只追加不修改
 */
@Entity
@Data
@Table(name = "connection_health_log", indexes = {
        @Index(name = "idx_health_conn", columnList = "connection_id"),
        @Index(name = "idx_health_time", columnList = "checked_at")
})
public class ConnectionHealthLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "connection_id", nullable = false)
    private Long connectionId;

    @Column(name = "checked_at", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private HealthStatus status;

    private Integer responseTimeMs;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * system / user / scheduler
     */
    @Column(length = 50, nullable = false)
    private String checkedBy = "system";
}
