package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckResult {
    private boolean healthy;
    private long responseTimeMs;
    private String errorMessage;
    private Instant timestamp;

    public static HealthCheckResult healthy(long responseTimeMs) {
        return new HealthCheckResult(true, responseTimeMs, null, Instant.now());
    }

    public static HealthCheckResult unhealthy(long responseTimeMs, String errorMessage) {
        return new HealthCheckResult(false, responseTimeMs, errorMessage, Instant.now());
    }
}
