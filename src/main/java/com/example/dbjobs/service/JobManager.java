package com.example.dbjobs.service;

import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.CronValidation;
import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.JobRequest;
import com.example.dbjobs.dto.JobValidation;
import com.example.dbjobs.dto.QueryResult;
import com.example.dbjobs.dto.QuickBackupRequest;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.entity.RetryPolicy;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.enums.ExecutionStatus;
import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.enums.TriggerSource;
import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.exception.ExecutionCancelledException;
import com.example.dbjobs.exception.JobAlreadyRunningException;
import com.example.dbjobs.exception.ResourceNotFoundException;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import com.example.dbjobs.repository.JobExecutionRepository;
import com.example.dbjobs.repository.ScheduledJobRepository;
import com.example.dbjobs.service.executor.BackupExecutor;
import com.example.dbjobs.service.executor.ExecutionContext;
import com.example.dbjobs.service.executor.JobExecutor;
import com.example.dbjobs.service.executor.JobExecutorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 作业编排：创建 / 执行 / 取消 / 统计
 * <p>
 * 执行流程: 加锁 -> PENDING -> RUNNING -> 解析连接 -> 前置 SQL -> 执行器 -> 后置 SQL (仅成功时)
 * -> 终态 + 作业统计 -> 失败时按重试策略登记 nextRetryAt，由 JobDispatcher 到期后拉起
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobManager {
    private static final int MAX_SAVE_ATTEMPTS = 3;


    private final ScheduledJobRepository jobRepo;
    private final JobExecutionRepository executionRepo;
    private final ConnectionProfileRepository profileRepo;
    private final ConnectionManager connectionManager;
    private final JobScheduler jobScheduler;
    private final RetryHandler retryHandler;
    private final JobStateManager stateManager;
    private final JobLockManager lockManager;
    private final ExecutionControlManager controlManager;
    private final JobExecutorRegistry executorRegistry;
    private final Clock clock;

    // ==========================================
    // 作业维护
    // ==========================================

    /**
     * 校验 cron / 时区 / 作业类型 / 目标连接 / 执行器配置，保存并计算首次 nextRunAt
     */
    @Transactional
    public ScheduledJob createJob(JobRequest request, Long actorId) {
        ScheduledJob job = new ScheduledJob();
        apply(job, request);
        job.setCreatedBy(actorId);
        checkJob(job);

        job.setNextRunAt(computeNextRun(job));
        ScheduledJob saved = jobRepo.save(job);
        log.info("作业[{}] {} 已创建, 类型 {}, 下次执行 {}", saved.getId(), saved.getName(), saved.getJobType(), saved.getNextRunAt());
        return saved;
    }

    @Transactional
    public ScheduledJob updateJob(Long jobId, JobRequest request) {
        ScheduledJob job = getJob(jobId);
        apply(job, request);
        checkJob(job);
        job.setNextRunAt(computeNextRun(job));
        return jobRepo.save(job);
    }

    @Transactional
    public void deleteJob(Long jobId) {
        ScheduledJob job = getJob(jobId);
        if (lockManager.isLocked(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        int removed = executionRepo.deleteByJobId(jobId);
        jobRepo.delete(job);
        log.info("作业[{}] 已删除, 同时清理执行记录 {} 条", jobId, removed);
    }

    /**
     * 手动启停；重新启用时清零连续失败数 (熔断的人工复位)
     */
    @Transactional
    public ScheduledJob setJobActive(Long jobId, boolean active) {
        ScheduledJob job = getJob(jobId);
        job.setActive(active);
        if (active) {
            retryHandler.resetRetryState(job);
            job.setNextRunAt(computeNextRun(job));
        } else {
            job.setNextRetryAt(null);
            job.setRetryParentExecutionId(null);
        }
        log.info("作业[{}] 已{}", jobId, active ? "启用" : "停用");
        return jobRepo.save(job);
    }

    public ScheduledJob getJob(Long jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    public List<ScheduledJob> listJobs() {
        return jobRepo.findAll();
    }

    private void apply(ScheduledJob job, JobRequest request) {
        if (request.getName() != null) job.setName(request.getName());
        if (request.getDescription() != null) job.setDescription(request.getDescription());
        if (request.getJobType() != null) job.setJobType(request.getJobType());
        if (request.getConnectionId() != null) job.setConnectionId(request.getConnectionId());
        if (request.getTargetSchema() != null) job.setTargetSchema(request.getTargetSchema());
        if (request.getCronExpression() != null) job.setCronExpression(StringUtils.trimToNull(request.getCronExpression()));
        if (request.getTimezone() != null) job.setTimezone(request.getTimezone());
        if (request.getActive() != null) job.setActive(request.getActive());
        if (request.getConfig() != null) job.setConfig(new LinkedHashMap<>(request.getConfig()));
        if (request.getPreExecutionSql() != null) job.setPreExecutionSql(StringUtils.trimToNull(request.getPreExecutionSql()));
        if (request.getPostExecutionSql() != null) job.setPostExecutionSql(StringUtils.trimToNull(request.getPostExecutionSql()));
        if (request.getRetryPolicy() != null) job.setRetryPolicy(request.getRetryPolicy());
        if (request.getMaxRuntimeSeconds() != null) job.setMaxRuntimeSeconds(request.getMaxRuntimeSeconds());
        if (request.getFailureThreshold() != null) job.setFailureThreshold(request.getFailureThreshold());
        if (request.getNotifyOnSuccess() != null) job.setNotifyOnSuccess(request.getNotifyOnSuccess());
        if (request.getNotifyOnFailure() != null) job.setNotifyOnFailure(request.getNotifyOnFailure());
        if (request.getNotificationEmails() != null) job.setNotificationEmails(request.getNotificationEmails());
        if (request.getNotificationWebhook() != null) job.setNotificationWebhook(request.getNotificationWebhook());
        if (job.getConfig() == null) job.setConfig(new LinkedHashMap<>());
    }

    private void checkJob(ScheduledJob job) {
        if (StringUtils.isBlank(job.getName())) {
            throw new ConfigurationException("Job name is required");
        }
        if (job.getJobType() == null || !executorRegistry.supports(job.getJobType())) {
            throw new ConfigurationException("Unsupported job type: " + job.getJobType());
        }
        if (job.getFailureThreshold() < 1) {
            throw new ConfigurationException("failure_threshold must be at least 1");
        }
        checkRetryPolicy(job.getRetryPolicy());
        JobScheduler.parseZone(job.getTimezone());
        if (job.getCronExpression() != null) {
            CronValidation validation = jobScheduler.validateCronExpression(job.getCronExpression());
            if (!validation.isValid()) {
                throw new ConfigurationException("Invalid cron expression: " + validation.getError());
            }
        }
        ConnectionProfile profile = loadProfile(job);

        // 建作业时不解密，只拿类型和库名做配置校验
        ConnectionTarget target = ConnectionTarget.builder()
                .dbType(profile.getDbType())
                .database(profile.getDatabaseName())
                .host(profile.getHost())
                .port(profile.getPort())
                .build();
        ValidationResult result = executorRegistry.create(job.getJobType(), buildContext(job, target, false)).validateConfig();
        if (!result.isValid()) {
            throw new ConfigurationException("Invalid job config: " + String.join("; ", result.getErrors()));
        }
        for (String warning : result.getWarnings()) {
            log.warn("作业 {} 配置警告: {}", job.getName(), warning);
        }
    }

    /**
     * 退避延迟要随重试次数单调不减，所以 multiplier 不能小于 1
     */
    private static void checkRetryPolicy(RetryPolicy policy) {
        if (policy == null) {
            return;
        }
        if (policy.getMaxRetries() < 0) {
            throw new ConfigurationException("retry_policy.max_retries must not be negative");
        }
        if (policy.getBaseDelaySeconds() < 0) {
            throw new ConfigurationException("retry_policy.base_delay_seconds must not be negative");
        }
        if (policy.getMaxBackoffSeconds() < 0) {
            throw new ConfigurationException("retry_policy.max_backoff_seconds must not be negative");
        }
        if (Double.isNaN(policy.getBackoffMultiplier()) || policy.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("retry_policy.backoff_multiplier must be at least 1");
        }
    }

    private Instant computeNextRun(ScheduledJob job) {
        if (job.getCronExpression() == null) {
            return null;
        }
        return jobScheduler.calculateNextRun(job.getCronExpression(), job.getTimezone());
    }

    private ConnectionProfile loadProfile(ScheduledJob job) {
        if (job.getConnectionId() == null) {
            throw new ConfigurationException("Target connection is required");
        }
        return profileRepo.findById(job.getConnectionId())
                .orElseThrow(() -> new ConfigurationException("Connection not found: " + job.getConnectionId()));
    }

    private ExecutionContext buildContext(ScheduledJob job, ConnectionTarget target, boolean withControl) {
        return ExecutionContext.builder()
                .target(target)
                .config(job.getConfig() == null ? Collections.emptyMap() : job.getConfig())
                .targetSchema(job.getTargetSchema())
                .maxRuntimeSeconds(job.getMaxRuntimeSeconds())
                .control(withControl ? controlManager : null)
                .clock(clock)
                .build();
    }

    // ==========================================
    // 执行
    // ==========================================

    /**
     * 定时和重试触发要求作业处于启用状态；手动触发不要求 (停用的作业也可以手动跑)
     * 同一作业同一时刻只允许一个执行，抢锁失败直接抛 {@link JobAlreadyRunningException}，不产生执行记录
     * 执行过程中的异常会先写入 FAILED 执行记录再抛出；被取消的执行正常返回 (状态 CANCELLED)
     */
    public JobExecution executeJob(Long jobId, Long actorId, TriggerSource triggeredBy) {
        log.info("开始执行作业[{}], 触发方式 {}", jobId, triggeredBy);
        ScheduledJob job = getJob(jobId);
        if (!job.isActive() && (triggeredBy == TriggerSource.SCHEDULE || triggeredBy == TriggerSource.RETRY)) {
            throw new ConfigurationException("Job is not active: " + jobId);
        }
        if (!lockManager.tryLock(jobId)) {
            log.warn("作业[{}] 正在执行，忽略本次触发 ({})", jobId, triggeredBy);
            throw new JobAlreadyRunningException(jobId);
        }
        try {
            return runLocked(jobId, actorId, triggeredBy);
        } finally {
            lockManager.releaseLock(jobId);
        }
    }

    private JobExecution runLocked(Long jobId, Long actorId, TriggerSource triggeredBy) {
        // 抢锁前读到的可能已被改过，锁内重读
        ScheduledJob job = getJob(jobId);
        if (!job.isActive() && (triggeredBy == TriggerSource.SCHEDULE || triggeredBy == TriggerSource.RETRY)) {
            throw new ConfigurationException("Job is not active: " + jobId);
        }
        int retryCount = 0;
        Long parentId = null;
        if (triggeredBy == TriggerSource.RETRY && job.getRetryParentExecutionId() != null) {
            parentId = job.getRetryParentExecutionId();
            retryCount = executionRepo.findById(parentId).map(p -> p.getRetryCount() + 1).orElse(1);
        }
        if (triggeredBy == TriggerSource.RETRY) {
            // 重试已被拉起，清掉待办
            ScheduledJob saved = modifyJob(jobId, j -> {
                j.setNextRetryAt(null);
                j.setRetryParentExecutionId(null);
            });
            if (saved != null) {
                job = saved;
            }
        }

        JobExecution execution = stateManager.createPending(job.getId(), triggeredBy, actorId, retryCount, parentId);
        Long executionId = execution.getId();
        try {
            stateManager.markRunning(executionId);

            ConnectionProfile profile = loadProfile(job);
            ConnectionTarget target = connectionManager.resolveTarget(profile);

            runHook(profile, job.getPreExecutionSql(), "pre-execution", executionId);
            controlManager.checkCancelled(executionId);

            JobExecutor executor = executorRegistry.create(job.getJobType(), buildContext(job, target, true));
            ExecutionResult result = executor.execute(executionId);

            if (result.isSuccess() && job.getPostExecutionSql() != null) {
                try {
                    runHook(profile, job.getPostExecutionSql(), "post-execution", executionId);
                } catch (RuntimeException e) {
                    result.setSuccess(false);
                    result.setErrorMessage(e.getMessage());
                    result.setErrorTrace(ExceptionUtils.getStackTrace(e));
                }
            }

            ExecutionStatus status = result.isSuccess() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
            JobExecution finished = stateManager.finish(executionId, status, result).orElse(null);
            if (finished == null) {
                // 执行过程中被取消，已是终态
                recordOutcome(job.getId(), null, false);
                return stateManager.load(executionId);
            }
            recordOutcome(job.getId(), finished, true);
            log.info("作业[{}] 执行[{}] 结束: {}", job.getId(), executionId, status);
            return finished;
        } catch (ExecutionCancelledException e) {
            log.warn("作业[{}] 执行[{}] 已取消", job.getId(), executionId);
            ExecutionResult cancelled = ExecutionResult.builder().success(false).errorMessage(e.getMessage()).build();
            stateManager.finish(executionId, ExecutionStatus.CANCELLED, cancelled);
            recordOutcome(job.getId(), null, false);
            return stateManager.load(executionId);
        } catch (RuntimeException e) {
            log.error("作业[{}] 执行[{}] 异常: {}", job.getId(), executionId, e.getMessage(), e);
            ExecutionResult failed = ExecutionResult.builder()
                    .success(false)
                    .errorMessage(e.getMessage())
                    .errorTrace(ExceptionUtils.getStackTrace(e))
                    .build();
            JobExecution finished = stateManager.finish(executionId, ExecutionStatus.FAILED, failed).orElse(null);
            // 配置错误不重试
            recordOutcome(job.getId(), finished, !(e instanceof ConfigurationException));
            throw e;
        } finally {
            controlManager.release(executionId);
        }
    }

    private void runHook(ConnectionProfile profile, String sql, String phase, Long executionId) {
        if (StringUtils.isBlank(sql)) {
            return;
        }
        log.info("执行[{}] 运行 {} SQL", executionId, phase);
        Connector connector = connectionManager.getConnector(profile);
        QueryResult hookResult = connector.executeQuery(sql, Collections.emptyMap());
        if (!hookResult.isSuccess()) {
            throw new IllegalStateException("The " + phase + " SQL failed: " + hookResult.getErrorMessage());
        }
    }

    /**
     * 更新作业统计
     *
     * @param execution 为空表示执行被取消，只记运行次数
     */
    private void recordOutcome(Long jobId, JobExecution execution, boolean retryable) {
        ScheduledJob saved = modifyJob(jobId, job -> {
            job.setRunCount(job.getRunCount() + 1);
            job.setLastRunAt(execution != null && execution.getCompletedAt() != null ? execution.getCompletedAt() : clock.instant());

            if (execution != null && execution.getStatus() == ExecutionStatus.COMPLETED) {
                job.setSuccessCount(job.getSuccessCount() + 1);
                retryHandler.resetRetryState(job);
            } else if (execution != null && execution.getStatus() == ExecutionStatus.FAILED) {
                retryHandler.incrementFailureCount(job);
                if (retryable && retryHandler.shouldRetry(job, execution)) {
                    Instant retryAt = retryHandler.calculateNextRetryTime(execution.getRetryCount(), job.getRetryPolicy());
                    job.setNextRetryAt(retryAt);
                    job.setRetryParentExecutionId(execution.getId());
                    log.info("作业[{}] 执行[{}] 失败，计划于 {} 重试", jobId, execution.getId(), retryAt);
                }
            }
            jobScheduler.refreshNextRun(job);
        });
        if (saved == null) {
            log.warn("作业[{}] 已被删除，跳过统计", jobId);
        }
    }

    /**
     * 重读 - 修改 - 保存；版本冲突时重读后再改，最多 {@value #MAX_SAVE_ATTEMPTS} 次
     *
     * @return 作业已被删除时返回 null
     */
    private ScheduledJob modifyJob(Long jobId, Consumer<ScheduledJob> change) {
        for (int attempt = 1; ; attempt++) {
            ScheduledJob job = jobRepo.findById(jobId).orElse(null);
            if (job == null) {
                return null;
            }
            change.accept(job);
            try {
                return jobRepo.save(job);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_SAVE_ATTEMPTS) {
                    throw e;
                }
                log.warn("作业[{}] 保存时版本冲突，第 {} 次重试", jobId, attempt);
            }
        }
    }

    /**
     * 只有 RUNNING 的执行可以取消，其他状态返回 false 且不做任何修改
     */
    public boolean cancelExecution(Long executionId) {
        boolean cancelled = stateManager.cancel(executionId);
        if (cancelled) {
            controlManager.cancel(executionId);
            log.info("执行[{}] 已取消", executionId);
        }
        return cancelled;
    }

    // ==========================================
    // 辅助功能
    // ==========================================

    public List<Instant> previewNextRuns(Long jobId, int count) {
        ScheduledJob job = getJob(jobId);
        if (job.getCronExpression() == null) {
            return Collections.emptyList();
        }
        return jobScheduler.calculateNextNRuns(job.getCronExpression(), count, job.getTimezone());
    }

    /**
     * 用解密后的真实连接信息重新校验作业配置，并列出所需权限
     */
    public JobValidation validateJob(Long jobId) {
        ScheduledJob job = getJob(jobId);
        ConnectionTarget target = connectionManager.resolveTarget(loadProfile(job));
        JobExecutor executor = executorRegistry.create(job.getJobType(), buildContext(job, target, false));
        return new JobValidation(executor.validateConfig(), executor.getRequiredPermissions());
    }

    /**
     * 一键备份：建一个停用的备份作业 (无 cron)，立即手动执行一次
     */
    public JobExecution quickBackup(QuickBackupRequest request, Long actorId) {
        ConnectionProfile profile = profileRepo.findById(request.getConnectionId())
                .orElseThrow(() -> new ResourceNotFoundException("Connection not found: " + request.getConnectionId()));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put(BackupExecutor.DATABASE_NAME,
                StringUtils.defaultIfBlank(request.getDatabaseName(), profile.getDatabaseName()));
        config.put(BackupExecutor.BACKUP_TYPE, request.getBackupType());
        config.put(BackupExecutor.COMPRESSION_ENABLED, request.isCompressionEnabled());
        config.put(BackupExecutor.RETENTION_DAYS, request.getRetentionDays());
        config.put(BackupExecutor.FORMAT, request.getFormat());
        if (StringUtils.isNotBlank(request.getStoragePath())) {
            config.put(BackupExecutor.STORAGE_PATH, request.getStoragePath());
        }

        JobRequest jobRequest = new JobRequest();
        jobRequest.setName("Quick backup " + profile.getName() + " " + clock.instant());
        jobRequest.setDescription("Quick backup of " + config.get(BackupExecutor.DATABASE_NAME));
        jobRequest.setJobType(JobType.DATABASE_BACKUP);
        jobRequest.setConnectionId(profile.getId());
        jobRequest.setActive(false);
        jobRequest.setConfig(config);

        ScheduledJob job = createJob(jobRequest, actorId);
        return executeJob(job.getId(), actorId, TriggerSource.MANUAL);
    }

    public List<ScheduledJob> findDueJobs() {
        return jobRepo.findByActiveTrueAndCronExpressionIsNotNullAndNextRunAtLessThanEqual(clock.instant());
    }

    public List<ScheduledJob> findDueRetries() {
        return jobRepo.findByActiveTrueAndNextRetryAtLessThanEqual(clock.instant());
    }

    public JobExecution getExecution(Long executionId) {
        return stateManager.load(executionId);
    }

    public Page<JobExecution> listExecutions(Long jobId, Pageable pageable) {
        getJob(jobId);
        return executionRepo.findByJobIdOrderByIdDesc(jobId, pageable);
    }

    public String getExecutionLogs(Long executionId) {
        return StringUtils.defaultString(getExecution(executionId).getExecutionLogs());
    }

    /**
     * 备份文件路径；文件已被清理时报 404 而不是返回一个不存在的路径
     */
    public Path resolveBackupArtifact(Long executionId) {
        JobExecution execution = getExecution(executionId);
        Object path = execution.getResult() == null ? null : execution.getResult().get(BackupExecutor.RESULT_BACKUP_PATH);
        if (path == null) {
            throw new ResourceNotFoundException("Execution " + executionId + " has no backup artifact");
        }
        Path file = Paths.get(path.toString());
        if (!Files.isRegularFile(file)) {
            throw new ResourceNotFoundException("Backup file not found: " + file);
        }
        return file;
    }
}
