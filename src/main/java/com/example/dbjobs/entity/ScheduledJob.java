package com.example.dbjobs.entity;

import com.example.dbjobs.enums.JobType;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 定时作业
 * 约束：consecutiveFailures >= failureThreshold 时 active 必须为 false (自动熔断)
 */
@Entity
@Data
@Table(name = "scheduled_job")
public class ScheduledJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 乐观锁：执行统计和人工修改都是整行保存，版本冲突时由调用方重读重试
    @Version
    private Long version;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobType jobType;

    @Column(name = "connection_id")
    private Long connectionId;
    private String targetSchema;

    // --- 调度 ---
    private String cronExpression;
    private String timezone = "UTC";
    private boolean active = true;

    /**
     * 各作业类型自己的配置，key 使用 snake_case (sql_script, backup_type ...)
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> config;

    @Column(columnDefinition = "TEXT")
    private String preExecutionSql;
    @Column(columnDefinition = "TEXT")
    private String postExecutionSql;

    @Embedded
    private RetryPolicy retryPolicy = new RetryPolicy();
    private int maxRuntimeSeconds = 3600;
    private int failureThreshold = 5;

    // --- 通知 (只保存偏好，不在本服务发送) ---
    private boolean notifyOnSuccess;
    private boolean notifyOnFailure = true;
    @Column(columnDefinition = "TEXT")
    private String notificationEmails;
    private String notificationWebhook;

    // --- 统计 ---
    private int runCount;
    private int successCount;
    private int failureCount;
    private int consecutiveFailures;
    private Instant lastRunAt;
    private Instant nextRunAt;

    // --- 待执行的重试 (由调度器在 nextRetryAt 到期后拉起) ---
    private Instant nextRetryAt;
    private Long retryParentExecutionId;

    private Long createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
