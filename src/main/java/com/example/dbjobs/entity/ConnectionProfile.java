package com.example.dbjobs.entity;

import com.example.dbjobs.enums.ConnectionMode;
import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.enums.HealthStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * 目标库连接档案
 *    1. 连接信息(密码只存密文，用时再解密)
 *    2. 连接池参数
 *    3. 健康状态与能力探测结果
 */
@Entity
@Data
@Table(name = "connection_profile")
public class ConnectionProfile {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DatabaseType dbType;

    private String host;
    private Integer port;

    /**
     * sqlite 时为文件路径
     */
    private String databaseName;
    private String username;
    private String schemaName;

    @JsonIgnore
    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String encryptedPassword;

    /**
     * 完整连接串(加密)，有值时优先于 host/port/user 拼装
     */
    @JsonIgnore
    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String encryptedConnectionString;

    // --- 连接池 ---
    private int poolSize = 5;
    private int maxConnections = 10;
    private int timeoutSeconds = 30;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ConnectionMode connectionMode = ConnectionMode.READ_WRITE;

    // --- SSL ---
    private boolean sslEnabled;
    private String sslCertPath;
    private String sslKeyPath;
    private String sslCaPath;

    private boolean active;
    private boolean defaultProfile;

    // --- 健康状态 (HealthMonitor 维护) ---
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private HealthStatus healthStatus = HealthStatus.UNKNOWN;
    private Instant lastHealthCheck;
    private Integer responseTimeMs;
    private int failedAttempts;

    /**
     * CapabilityDetector 缓存的探测结果
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> capabilities;

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
