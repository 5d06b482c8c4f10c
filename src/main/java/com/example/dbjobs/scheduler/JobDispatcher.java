package com.example.dbjobs.scheduler;

import com.example.dbjobs.config.AppProperties;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.enums.TriggerSource;
import com.example.dbjobs.exception.JobAlreadyRunningException;
import com.example.dbjobs.service.ConnectionManager;
import com.example.dbjobs.service.HealthMonitor;
import com.example.dbjobs.service.JobManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 调度循环：到期作业 / 到期重试提交到 jobExecutor，健康巡检提交到 healthExecutor
 */
@Component
@Slf4j
public class JobDispatcher {

    private final JobManager jobManager;
    private final HealthMonitor healthMonitor;
    private final ConnectionManager connectionManager;
    private final AppProperties config;
    private final TaskExecutor jobExecutor;
    private final TaskExecutor healthExecutor;

    // 内存防抖 Set (防止同一作业重复提交到队列)
    private final Set<Long> inFlightJobs = ConcurrentHashMap.newKeySet();

    public JobDispatcher(JobManager jobManager,
                         HealthMonitor healthMonitor,
                         ConnectionManager connectionManager,
                         AppProperties config,
                         @Qualifier("jobExecutor") TaskExecutor jobExecutor,
                         @Qualifier("healthExecutor") TaskExecutor healthExecutor) {
        this.jobManager = jobManager;
        this.healthMonitor = healthMonitor;
        this.connectionManager = connectionManager;
        this.config = config;
        this.jobExecutor = jobExecutor;
        this.healthExecutor = healthExecutor;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.poll-interval-ms:10000}")
    public void schedule() {
        if (!config.getScheduler().isEnabled()) {
            return;
        }
        dispatchDueJobs();
        dispatchDueRetries();
    }

    void dispatchDueJobs() {
        List<ScheduledJob> jobs = jobManager.findDueJobs();
        for (ScheduledJob job : jobs) {
            submit(job.getId(), TriggerSource.SCHEDULE);
        }
    }

    void dispatchDueRetries() {
        List<ScheduledJob> jobs = jobManager.findDueRetries();
        for (ScheduledJob job : jobs) {
            submit(job.getId(), TriggerSource.RETRY);
        }
    }

    private void submit(Long jobId, TriggerSource trigger) {
        if (!inFlightJobs.add(jobId)) {
            return; // 防抖
        }
        try {
            jobExecutor.execute(() -> {
                try {
                    jobManager.executeJob(jobId, null, trigger);
                } catch (JobAlreadyRunningException e) {
                    log.info("作业[{}] 正在手动执行，跳过本次 {} 触发", jobId, trigger);
                } catch (RuntimeException e) {
                    // 执行记录里已有完整错误，这里只留一行
                    log.error("作业[{}] {} 触发执行失败: {}", jobId, trigger, e.getMessage());
                } finally {
                    inFlightJobs.remove(jobId);
                }
            });
        } catch (TaskRejectedException e) {
            inFlightJobs.remove(jobId);
            log.warn("作业线程池已满，作业[{}] 留到下一轮调度", jobId);
        }
    }

    @Scheduled(fixedDelayString = "${app.health.sweep-interval-ms:60000}",
            initialDelayString = "${app.health.sweep-interval-ms:60000}")
    public void sweepHealth() {
        if (!config.getHealth().isSweepEnabled()) {
            return;
        }
        healthExecutor.execute(() -> {
            try {
                healthMonitor.monitorAllConnections();
            } catch (RuntimeException e) {
                log.error("健康巡检失败: {}", e.getMessage(), e);
            }
        });
    }

    @Scheduled(fixedDelayString = "${app.connector.cleanup-interval-ms:300000}",
            initialDelayString = "${app.connector.cleanup-interval-ms:300000}")
    public void cleanupConnections() {
        connectionManager.cleanupIdleConnections();
    }
}
