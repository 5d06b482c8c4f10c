package com.example.dbjobs.service;

import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.JobRequest;
import com.example.dbjobs.dto.QueryResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.entity.RetryPolicy;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.enums.DatabaseType;
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
import com.example.dbjobs.service.executor.JobExecutor;
import com.example.dbjobs.service.executor.JobExecutorFactory;
import com.example.dbjobs.service.executor.JobExecutorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:02:00Z");
    private static final Long JOB_ID = 10L;
    private static final Long CONN_ID = 1L;

    @Mock private ScheduledJobRepository jobRepo;
    @Mock private JobExecutionRepository executionRepo;
    @Mock private ConnectionProfileRepository profileRepo;
    @Mock private ConnectionManager connectionManager;
    @Mock private JobExecutorFactory executorFactory;
    @Mock private JobExecutor executor;
    @Mock private Connector connector;

    @TempDir Path tempDir;

    private final Map<Long, JobExecution> executions = new HashMap<>();
    private final AtomicLong executionIds = new AtomicLong(100);

    private JobLockManager lockManager;
    private JobManager jobManager;
    private ConnectionProfile profile;
    private ScheduledJob job;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        lockManager = new JobLockManager();

        lenient().when(executorFactory.getJobType()).thenReturn(JobType.SQL_SCRIPT);
        lenient().when(executorFactory.create(any())).thenReturn(executor);
        JobExecutorRegistry registry = new JobExecutorRegistry(List.of(executorFactory));

        jobManager = new JobManager(jobRepo, executionRepo, profileRepo, connectionManager,
                new JobScheduler(jobRepo, clock), new RetryHandler(clock),
                new JobStateManager(executionRepo, clock), lockManager,
                new ExecutionControlManager(), registry, clock);

        // 执行记录存在内存里
        lenient().when(executionRepo.save(any(JobExecution.class))).thenAnswer(inv -> {
            JobExecution e = inv.getArgument(0);
            if (e.getId() == null) {
                e.setId(executionIds.incrementAndGet());
            }
            executions.put(e.getId(), e);
            return e;
        });
        lenient().when(executionRepo.findById(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(executions.get(inv.<Long>getArgument(0))));
        lenient().when(jobRepo.save(any(ScheduledJob.class))).thenAnswer(inv -> inv.getArgument(0));

        profile = new ConnectionProfile();
        profile.setId(CONN_ID);
        profile.setName("pg-main");
        profile.setDbType(DatabaseType.POSTGRESQL);
        profile.setDatabaseName("sales");
        lenient().when(profileRepo.findById(CONN_ID)).thenReturn(Optional.of(profile));
        lenient().when(connectionManager.resolveTarget(profile)).thenReturn(ConnectionTarget.builder()
                .dbType(DatabaseType.POSTGRESQL).url("jdbc:postgresql://h:5432/sales").build());

        job = new ScheduledJob();
        job.setId(JOB_ID);
        job.setName("nightly cleanup");
        job.setJobType(JobType.SQL_SCRIPT);
        job.setConnectionId(CONN_ID);
        job.setConfig(new HashMap<>(Map.of("sql_script", "DELETE FROM t")));
        lenient().when(jobRepo.findById(JOB_ID)).thenReturn(Optional.of(job));
    }

    private static ExecutionResult failed(String message) {
        return ExecutionResult.builder().success(false).errorMessage(message).executionLog("[x] [ERROR] " + message).build();
    }

    private static ExecutionResult succeeded() {
        return ExecutionResult.builder().success(true).rowsAffected(4).resultData(Map.of("k", "v")).build();
    }

    // ==========================================
    // 创建
    // ==========================================

    @Test
    @DisplayName("创建作业时计算首次执行时间 (UTC)")
    void createJob_firstRun() {
        when(executor.validateConfig()).thenReturn(ValidationResult.of(List.of(), List.of()));
        JobRequest request = new JobRequest();
        request.setName("every five");
        request.setJobType(JobType.SQL_SCRIPT);
        request.setConnectionId(CONN_ID);
        request.setCronExpression("*/5 * * * *");
        request.setTimezone("UTC");
        request.setConfig(Map.of("sql_script", "SELECT 1"));

        ScheduledJob created = jobManager.createJob(request, 42L);

        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), created.getNextRunAt());
        assertEquals(42L, created.getCreatedBy());
        assertTrue(created.isActive());
    }

    @Test
    @DisplayName("创建作业: 非法 cron / 时区 / 连接 / 配置都报配置错误")
    void createJob_invalid() {
        JobRequest request = new JobRequest();
        request.setName("bad");
        request.setJobType(JobType.SQL_SCRIPT);
        request.setConnectionId(CONN_ID);

        request.setCronExpression("every day");
        assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));

        request.setCronExpression("0 * * * *");
        request.setTimezone("Nowhere/City");
        assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));

        request.setTimezone("UTC");
        request.setConnectionId(99L);
        assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));

        request.setConnectionId(CONN_ID);
        when(executor.validateConfig()).thenReturn(ValidationResult.of(List.of("Missing required field: sql_script"), List.of()));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));
        assertTrue(e.getMessage().contains("sql_script"));

        request.setJobType(JobType.DATABASE_BACKUP);
        assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));
        verify(jobRepo, never()).save(any());
    }

    @Test
    @DisplayName("创建作业: 重试策略的负数和小于 1 的退避倍数被拒绝")
    void createJob_invalidRetryPolicy() {
        JobRequest request = new JobRequest();
        request.setName("bad retry");
        request.setJobType(JobType.SQL_SCRIPT);
        request.setConnectionId(CONN_ID);

        request.setRetryPolicy(new RetryPolicy(3, 60, 0.5, 3600));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null));
        assertTrue(e.getMessage().contains("backoff_multiplier"));

        request.setRetryPolicy(new RetryPolicy(-1, 60, 2.0, 3600));
        assertTrue(assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null))
                .getMessage().contains("max_retries"));

        request.setRetryPolicy(new RetryPolicy(3, -60, 2.0, 3600));
        assertTrue(assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null))
                .getMessage().contains("base_delay_seconds"));

        request.setRetryPolicy(new RetryPolicy(3, 60, 2.0, -1));
        assertTrue(assertThrows(ConfigurationException.class, () -> jobManager.createJob(request, null))
                .getMessage().contains("max_backoff_seconds"));
        verify(jobRepo, never()).save(any());
    }

    // ==========================================
    // 执行
    // ==========================================

    @Test
    @DisplayName("执行成功: COMPLETED，统计更新，重试状态清零")
    void execute_success() {
        job.setConsecutiveFailures(2);
        job.setNextRetryAt(NOW);
        when(executor.execute(anyLong())).thenReturn(succeeded());

        JobExecution execution = jobManager.executeJob(JOB_ID, 7L, TriggerSource.MANUAL);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(NOW, execution.getStartedAt());
        assertEquals(NOW, execution.getCompletedAt());
        assertEquals(0L, execution.getDurationMs());
        assertEquals(4L, execution.getRowsAffected());
        assertEquals(7L, execution.getTriggeredByUserId());
        assertEquals(TriggerSource.MANUAL, execution.getTriggeredBy());
        assertEquals(1, job.getRunCount());
        assertEquals(1, job.getSuccessCount());
        assertEquals(0, job.getConsecutiveFailures());
        assertNull(job.getNextRetryAt());
        assertEquals(NOW, job.getLastRunAt());
        assertFalse(lockManager.isLocked(JOB_ID));
    }

    @Test
    @DisplayName("失败阈值 3: 连续手动失败三次后作业被停用")
    void execute_threeFailuresDisableJob() {
        job.setFailureThreshold(3);
        when(executor.execute(anyLong())).thenReturn(failed("boom"));

        for (int i = 0; i < 3; i++) {
            JobExecution execution = jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL);
            assertEquals(ExecutionStatus.FAILED, execution.getStatus());
            assertEquals("boom", execution.getErrorMessage());
        }

        assertFalse(job.isActive());
        assertEquals(3, job.getConsecutiveFailures());
        assertEquals(3, job.getFailureCount());
        assertEquals(3, job.getRunCount());
        assertNull(job.getNextRetryAt());
    }

    @Test
    @DisplayName("可重试的失败登记 nextRetryAt 和父执行")
    void execute_failureSchedulesRetry() {
        when(executor.execute(anyLong())).thenReturn(failed("deadlock"));

        JobExecution execution = jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL);

        assertEquals(NOW.plusSeconds(60), job.getNextRetryAt());
        assertEquals(execution.getId(), job.getRetryParentExecutionId());
    }

    @Test
    @DisplayName("重试触发: 链到父执行，retryCount = 父 + 1")
    void execute_retryChained() {
        JobExecution parent = new JobExecution();
        parent.setJobId(JOB_ID);
        parent.setStatus(ExecutionStatus.FAILED);
        parent.setRetryCount(1);
        executionRepo.save(parent);
        job.setRetryParentExecutionId(parent.getId());
        job.setNextRetryAt(NOW);
        when(executor.execute(anyLong())).thenReturn(succeeded());

        JobExecution retry = jobManager.executeJob(JOB_ID, null, TriggerSource.RETRY);

        assertEquals(parent.getId(), retry.getParentExecutionId());
        assertEquals(2, retry.getRetryCount());
        assertEquals(TriggerSource.RETRY, retry.getTriggeredBy());
        assertNull(job.getNextRetryAt());
        assertNull(job.getRetryParentExecutionId());
    }

    @Test
    @DisplayName("执行器抛异常: 先记 FAILED (带堆栈) 再抛出")
    void execute_exceptionCaptured() {
        when(executor.execute(anyLong())).thenThrow(new IllegalStateException("driver crashed"));

        assertThrows(IllegalStateException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL));

        JobExecution execution = executions.values().iterator().next();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals("driver crashed", execution.getErrorMessage());
        assertTrue(execution.getErrorStackTrace().contains("IllegalStateException"));
        assertNotNull(execution.getCompletedAt());
        assertEquals(1, job.getFailureCount());
        assertFalse(lockManager.isLocked(JOB_ID));
    }

    @Test
    @DisplayName("配置错误不安排重试")
    void execute_configurationErrorNotRetried() {
        when(connectionManager.resolveTarget(profile)).thenThrow(new ConfigurationException("cannot decrypt"));

        assertThrows(ConfigurationException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL));

        assertEquals(1, job.getConsecutiveFailures());
        assertNull(job.getNextRetryAt());
        verify(executor, never()).execute(anyLong());
    }

    @Test
    @DisplayName("作业正在执行时再次触发: 直接拒绝，不产生执行记录")
    void execute_locked() {
        lockManager.tryLock(JOB_ID);

        assertThrows(JobAlreadyRunningException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL));
        verify(executionRepo, never()).save(any());
        assertTrue(executions.isEmpty());
    }

    @Test
    @DisplayName("停用的作业: 定时触发拒绝，手动触发允许")
    void execute_inactiveJob() {
        job.setActive(false);
        assertThrows(ConfigurationException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.SCHEDULE));
        assertTrue(executions.isEmpty());

        when(executor.execute(anyLong())).thenReturn(succeeded());
        assertEquals(ExecutionStatus.COMPLETED, jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL).getStatus());
    }

    @Test
    @DisplayName("抢到锁后重读作业: 期间被停用的作业不再定时执行")
    void execute_reloadsJobAfterLock() {
        ScheduledJob disabled = copyOf(job);
        disabled.setActive(false);
        when(jobRepo.findById(JOB_ID)).thenReturn(Optional.of(job), Optional.of(disabled));

        assertThrows(ConfigurationException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.SCHEDULE));

        assertTrue(executions.isEmpty());
        assertFalse(lockManager.isLocked(JOB_ID));
    }

    @Test
    @DisplayName("统计保存遇到版本冲突: 重读最新数据再累加，不覆盖他人修改")
    void execute_staleSaveRetried() {
        job.setRunCount(1);
        ScheduledJob latest = copyOf(job);
        latest.setRunCount(5);
        latest.setSuccessCount(2);
        latest.setNotificationEmails("ops@example.com");
        when(jobRepo.findById(JOB_ID)).thenReturn(Optional.of(job), Optional.of(job), Optional.of(job), Optional.of(latest));
        when(jobRepo.save(any(ScheduledJob.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(ScheduledJob.class, JOB_ID))
                .thenAnswer(inv -> inv.getArgument(0));
        when(executor.execute(anyLong())).thenReturn(succeeded());

        JobExecution execution = jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        verify(jobRepo, times(2)).save(any(ScheduledJob.class));
        assertEquals(6, latest.getRunCount());
        assertEquals(3, latest.getSuccessCount());
        assertEquals("ops@example.com", latest.getNotificationEmails());
    }

    private static ScheduledJob copyOf(ScheduledJob source) {
        ScheduledJob copy = new ScheduledJob();
        copy.setId(source.getId());
        copy.setName(source.getName());
        copy.setJobType(source.getJobType());
        copy.setConnectionId(source.getConnectionId());
        copy.setConfig(new HashMap<>(source.getConfig()));
        copy.setActive(source.isActive());
        copy.setRunCount(source.getRunCount());
        copy.setSuccessCount(source.getSuccessCount());
        copy.setFailureCount(source.getFailureCount());
        copy.setConsecutiveFailures(source.getConsecutiveFailures());
        return copy;
    }

    @Test
    @DisplayName("作业不存在")
    void execute_missingJob() {
        when(jobRepo.findById(404L)).thenReturn(Optional.empty());
        assertThrows(ResourceNotFoundException.class, () -> jobManager.executeJob(404L, null, TriggerSource.MANUAL));
    }

    @Test
    @DisplayName("前置 SQL 失败: 执行失败，执行器不运行")
    void execute_preHookFails() {
        job.setPreExecutionSql("LOCK TABLE t");
        when(connectionManager.getConnector(profile)).thenReturn(connector);
        when(connector.executeQuery(eqSql("LOCK TABLE t"), any())).thenReturn(QueryResult.error("permission denied", 1));

        assertThrows(IllegalStateException.class, () -> jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL));

        JobExecution execution = executions.values().iterator().next();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertTrue(execution.getErrorMessage().contains("permission denied"));
        verify(executor, never()).execute(anyLong());
    }

    @Test
    @DisplayName("后置 SQL 只在成功后运行")
    void execute_postHookOnlyOnSuccess() {
        job.setPostExecutionSql("ANALYZE t");
        when(executor.execute(anyLong())).thenReturn(failed("nope"));

        jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL);
        verify(connectionManager, never()).getConnector(any(ConnectionProfile.class));

        when(executor.execute(anyLong())).thenReturn(succeeded());
        when(connectionManager.getConnector(profile)).thenReturn(connector);
        when(connector.executeQuery(eqSql("ANALYZE t"), any())).thenReturn(QueryResult.success(List.of(), List.of(), 1));

        assertEquals(ExecutionStatus.COMPLETED, jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL).getStatus());
        verify(connector).executeQuery(eqSql("ANALYZE t"), any());
    }

    private static String eqSql(String sql) {
        return org.mockito.ArgumentMatchers.eq(sql);
    }

    // ==========================================
    // 取消
    // ==========================================

    @Test
    @DisplayName("执行中被取消: 状态 CANCELLED，不计失败")
    void execute_cancelledMidway() {
        when(executor.execute(anyLong())).thenAnswer(inv -> {
            Long executionId = inv.getArgument(0);
            assertTrue(jobManager.cancelExecution(executionId));
            throw new ExecutionCancelledException("cancelled");
        });

        JobExecution execution = jobManager.executeJob(JOB_ID, null, TriggerSource.MANUAL);

        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertNotNull(execution.getCompletedAt());
        assertEquals(1, job.getRunCount());
        assertEquals(0, job.getFailureCount());
        assertNull(job.getNextRetryAt());
    }

    @Test
    @DisplayName("只有 RUNNING 可以取消，其它状态返回 false 且不改动")
    void cancel_onlyRunning() {
        JobExecution done = new JobExecution();
        done.setJobId(JOB_ID);
        done.setStatus(ExecutionStatus.COMPLETED);
        done.setCompletedAt(NOW);
        executionRepo.save(done);

        JobExecution pending = new JobExecution();
        pending.setJobId(JOB_ID);
        executionRepo.save(pending);

        assertFalse(jobManager.cancelExecution(done.getId()));
        assertEquals(ExecutionStatus.COMPLETED, done.getStatus());
        assertFalse(jobManager.cancelExecution(pending.getId()));
        assertEquals(ExecutionStatus.PENDING, pending.getStatus());
        assertNull(pending.getCompletedAt());
    }

    @Test
    @DisplayName("取消 RUNNING 的执行: 记录完成时间和耗时")
    void cancel_running() {
        JobExecution running = new JobExecution();
        running.setJobId(JOB_ID);
        running.setStatus(ExecutionStatus.RUNNING);
        running.setStartedAt(NOW.minusSeconds(5));
        executionRepo.save(running);

        assertTrue(jobManager.cancelExecution(running.getId()));
        assertEquals(ExecutionStatus.CANCELLED, running.getStatus());
        assertEquals(NOW, running.getCompletedAt());
        assertEquals(5000L, running.getDurationMs());
    }

    // ==========================================
    // 其它
    // ==========================================

    @Test
    @DisplayName("重新启用作业清零连续失败数")
    void setActive_resetsCircuitBreaker() {
        job.setActive(false);
        job.setConsecutiveFailures(5);

        jobManager.setJobActive(JOB_ID, true);

        assertTrue(job.isActive());
        assertEquals(0, job.getConsecutiveFailures());
    }

    @Test
    @DisplayName("删除作业级联删除执行记录")
    void deleteJob_cascades() {
        jobManager.deleteJob(JOB_ID);
        verify(executionRepo).deleteByJobId(JOB_ID);
        verify(jobRepo).delete(job);
    }

    @Test
    @DisplayName("备份文件: 存在返回路径，已被删除报 404")
    void resolveBackupArtifact() throws Exception {
        Path file = Files.writeString(tempDir.resolve("sales_full_20260101_000200.dump.gz"), "x");
        JobExecution execution = new JobExecution();
        execution.setJobId(JOB_ID);
        execution.setStatus(ExecutionStatus.COMPLETED);
        execution.setResult(new HashMap<>(Map.of(BackupExecutor.RESULT_BACKUP_PATH, file.toString())));
        executionRepo.save(execution);

        assertEquals(file, jobManager.resolveBackupArtifact(execution.getId()));

        Files.delete(file);
        assertThrows(ResourceNotFoundException.class, () -> jobManager.resolveBackupArtifact(execution.getId()));
    }

    @Test
    @DisplayName("没有 cron 的作业预览为空")
    void previewNextRuns() {
        assertTrue(jobManager.previewNextRuns(JOB_ID, 5).isEmpty());
        job.setCronExpression("0 * * * *");
        assertEquals(List.of(Instant.parse("2026-01-01T01:00:00Z"), Instant.parse("2026-01-01T02:00:00Z")),
                jobManager.previewNextRuns(JOB_ID, 2));
    }
}
