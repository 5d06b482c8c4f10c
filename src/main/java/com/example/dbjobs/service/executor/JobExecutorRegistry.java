package com.example.dbjobs.service.executor;

import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class JobExecutorRegistry {

    private final Map<JobType, JobExecutorFactory> factories = new EnumMap<>(JobType.class);

    public JobExecutorRegistry(List<JobExecutorFactory> factoryList) {
        for (JobExecutorFactory factory : factoryList) {
            JobExecutorFactory previous = factories.put(factory.getJobType(), factory);
            if (previous != null) {
                throw new IllegalStateException("作业类型重复注册: " + factory.getJobType());
            }
        }
        log.info("已注册执行器: {}", factories.keySet());
    }

    public JobExecutor create(JobType jobType, ExecutionContext context) {
        JobExecutorFactory factory = jobType == null ? null : factories.get(jobType);
        if (factory == null) {
            throw new ConfigurationException("Unknown job type: " + jobType);
        }
        return factory.create(context);
    }

    public boolean supports(JobType jobType) {
        return jobType != null && factories.containsKey(jobType);
    }
}
