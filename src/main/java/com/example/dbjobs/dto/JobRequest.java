package com.example.dbjobs.dto;

import com.example.dbjobs.entity.RetryPolicy;
import com.example.dbjobs.enums.JobType;
import lombok.Data;

import java.util.Map;

/**
 * 创建 / 修改作业的入参
 */
@Data
public class JobRequest {
    private String name;
    private String description;
    private JobType jobType;
    private Long connectionId;
    private String targetSchema;
    private String cronExpression;
    private String timezone;
    private Boolean active;
    private Map<String, Object> config;
    private String preExecutionSql;
    private String postExecutionSql;
    private RetryPolicy retryPolicy;
    private Integer maxRuntimeSeconds;
    private Integer failureThreshold;
    private Boolean notifyOnSuccess;
    private Boolean notifyOnFailure;
    private String notificationEmails;
    private String notificationWebhook;
}
