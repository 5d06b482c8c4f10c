package com.example.dbjobs.service;

import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.entity.RetryPolicy;
import com.example.dbjobs.entity.ScheduledJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 重试策略的判定和计数，不负责真正发起重试 (由 JobDispatcher 在 nextRetryAt 到期后拉起)
 * 计数方法只修改实体，保存由调用方负责
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryHandler {
    private final Clock clock;

    public boolean shouldRetry(ScheduledJob job, JobExecution execution) {
        RetryPolicy policy = policyOf(job);
        if (execution.getRetryCount() >= policy.getMaxRetries()) {
            log.info("作业[{}] 已达最大重试次数 {}/{}", job.getId(), execution.getRetryCount(), policy.getMaxRetries());
            return false;
        }
        if (!job.isActive()) {
            log.info("作业[{}] 已停用，不再重试", job.getId());
            return false;
        }
        if (job.getConsecutiveFailures() >= job.getFailureThreshold()) {
            log.warn("作业[{}] 连续失败 {} 次，达到阈值 {}", job.getId(), job.getConsecutiveFailures(), job.getFailureThreshold());
            return false;
        }
        return true;
    }

    /**
     * min(base * multiplier^retryCount, maxBackoff)，单位秒
     */
    public long calculateBackoffDelay(int retryCount, RetryPolicy policy) {
        RetryPolicy p = policy != null ? policy : new RetryPolicy();
        double delay = p.getBaseDelaySeconds() * Math.pow(p.getBackoffMultiplier(), Math.max(0, retryCount));
        long capped = (long) Math.min(delay, (double) p.getMaxBackoffSeconds());
        log.debug("重试退避: retryCount={}, delay={}s", retryCount, capped);
        return capped;
    }

    public Instant calculateNextRetryTime(int retryCount, RetryPolicy policy) {
        return clock.instant().plusSeconds(calculateBackoffDelay(retryCount, policy));
    }

    public void resetRetryState(ScheduledJob job) {
        job.setConsecutiveFailures(0);
        job.setNextRetryAt(null);
        job.setRetryParentExecutionId(null);
    }

    /**
     * 失败计数 +1；连续失败达到阈值时自动停用作业 (熔断)
     */
    public void incrementFailureCount(ScheduledJob job) {
        job.setFailureCount(job.getFailureCount() + 1);
        job.setConsecutiveFailures(job.getConsecutiveFailures() + 1);
        if (job.getConsecutiveFailures() >= job.getFailureThreshold()) {
            job.setActive(false);
            job.setNextRetryAt(null);
            job.setRetryParentExecutionId(null);
            log.warn("作业[{}] 连续失败 {} 次 (阈值 {})，已自动停用", job.getId(),
                    job.getConsecutiveFailures(), job.getFailureThreshold());
        }
    }

    private static RetryPolicy policyOf(ScheduledJob job) {
        return job.getRetryPolicy() != null ? job.getRetryPolicy() : new RetryPolicy();
    }
}
