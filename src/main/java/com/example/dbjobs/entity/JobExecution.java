package com.example.dbjobs.entity;

import com.example.dbjobs.enums.ExecutionStatus;
import com.example.dbjobs.enums.TriggerSource;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * 作业的一次执行
 * completedAt 有值 <=> status 为终态
 */
@Entity
@Data
@Table(name = "job_execution", indexes = @Index(name = "idx_execution_job", columnList = "job_id"))
public class JobExecution {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> result;

    private Long rowsProcessed;
    private Long rowsAffected;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String errorStackTrace;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String executionLogs;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> resourceUsage;

    private int retryCount;
    private Long parentExecutionId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private TriggerSource triggeredBy;
    private Long triggeredByUserId;

    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
