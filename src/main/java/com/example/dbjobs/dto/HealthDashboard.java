package com.example.dbjobs.dto;

import com.example.dbjobs.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 健康看板快照
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthDashboard {
    private Instant generatedAt;
    private Map<HealthStatus, Long> statusCounts;
    private List<ConnectionHealth> connections;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionHealth {
        private Long connectionId;
        private String name;
        private HealthStatus status;
        private Integer responseTimeMs;
        private int failedAttempts;
        private Instant lastHealthCheck;
    }
}
