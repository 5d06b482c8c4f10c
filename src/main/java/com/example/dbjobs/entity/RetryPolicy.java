package com.example.dbjobs.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重试策略：delay = min(baseDelay * multiplier^retryCount, maxBackoff)
 */
@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {
    private int maxRetries = 3;
    private long baseDelaySeconds = 60;
    private double backoffMultiplier = 2.0;
    private long maxBackoffSeconds = 3600;
}
