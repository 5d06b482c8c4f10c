package com.example.dbjobs.service;

import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.enums.ExecutionStatus;
import com.example.dbjobs.enums.TriggerSource;
import com.example.dbjobs.exception.ResourceNotFoundException;
import com.example.dbjobs.repository.JobExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 执行记录的状态流转，每一步独立事务提交，外面看到的始终是最新状态
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobStateManager {

    private final JobExecutionRepository executionRepo;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public JobExecution createPending(Long jobId, TriggerSource triggeredBy, Long actorId,
                                      int retryCount, Long parentExecutionId) {
        JobExecution execution = new JobExecution();
        execution.setJobId(jobId);
        execution.setStatus(ExecutionStatus.PENDING);
        execution.setTriggeredBy(triggeredBy);
        execution.setTriggeredByUserId(actorId);
        execution.setRetryCount(retryCount);
        execution.setParentExecutionId(parentExecutionId);
        execution.setCreatedAt(clock.instant());
        return executionRepo.save(execution);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public JobExecution markRunning(Long executionId) {
        JobExecution execution = load(executionId);
        if (!execution.getStatus().canTransitionTo(ExecutionStatus.RUNNING)) {
            throw new IllegalStateException("状态流转非法: " + execution.getStatus() + " -> RUNNING");
        }
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setStartedAt(clock.instant());
        return executionRepo.save(execution);
    }

    /**
     * 写入终态；执行已被取消 (或已是终态) 时不覆盖，返回 empty
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<JobExecution> finish(Long executionId, ExecutionStatus target, ExecutionResult result) {
        JobExecution execution = load(executionId);
        if (!execution.getStatus().canTransitionTo(target)) {
            log.info("执行[{}] 状态流转被拒绝: {} -> {}", executionId, execution.getStatus(), target);
            return Optional.empty();
        }
        Instant now = clock.instant();
        execution.setStatus(target);
        execution.setCompletedAt(now);
        if (execution.getStartedAt() != null) {
            execution.setDurationMs(now.toEpochMilli() - execution.getStartedAt().toEpochMilli());
        }
        if (result != null) {
            execution.setRowsProcessed(result.getRowsProcessed());
            execution.setRowsAffected(result.getRowsAffected());
            execution.setResult(result.getResultData());
            execution.setErrorMessage(result.getErrorMessage());
            execution.setErrorStackTrace(result.getErrorTrace());
            execution.setExecutionLogs(result.getExecutionLog());
            execution.setResourceUsage(result.getResourceUsage());
        }
        return Optional.of(executionRepo.save(execution));
    }

    /**
     * 只有 RUNNING 可以取消
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancel(Long executionId) {
        JobExecution execution = load(executionId);
        if (execution.getStatus() != ExecutionStatus.RUNNING) {
            log.info("执行[{}] 当前状态 {}，不能取消", executionId, execution.getStatus());
            return false;
        }
        Instant now = clock.instant();
        execution.setStatus(ExecutionStatus.CANCELLED);
        execution.setCompletedAt(now);
        if (execution.getStartedAt() != null) {
            execution.setDurationMs(now.toEpochMilli() - execution.getStartedAt().toEpochMilli());
        }
        execution.setErrorMessage("Execution cancelled");
        executionRepo.save(execution);
        return true;
    }

    public JobExecution load(Long executionId) {
        return executionRepo.findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Execution not found: " + executionId));
    }
}
