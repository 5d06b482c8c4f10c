package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.enums.JobType;

import java.util.List;

/**
 * 一种作业类型的执行逻辑，每次执行新建一个实例
 */
public interface JobExecutor {

    JobType getJobType();

    ValidationResult validateConfig();

    /**
     * 预期内的失败 (SQL 错误、子进程失败) 通过 success=false 返回；
     * 被取消时抛 {@link com.example.dbjobs.exception.ExecutionCancelledException}
     */
    ExecutionResult execute(Long executionId);

    /**
     * 执行前展示给用户的目标库权限要求
     */
    List<String> getRequiredPermissions();
}
