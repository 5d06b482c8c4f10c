package com.example.dbjobs.service.executor;

import com.example.dbjobs.enums.JobType;

/**
 * 按作业类型注册，新增作业类型只需再注册一个工厂
 */
public interface JobExecutorFactory {

    JobType getJobType();

    JobExecutor create(ExecutionContext context);
}
