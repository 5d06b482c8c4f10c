package com.example.dbjobs.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 执行器的统一返回
 */
@Data
@Builder
public class ExecutionResult {
    private boolean success;
    @Builder.Default
    private long rowsProcessed = 0;
    @Builder.Default
    private long rowsAffected = 0;
    private Map<String, Object> resultData;
    private String errorMessage;
    private String errorTrace;
    @Builder.Default
    private String executionLog = "";
    private Map<String, Object> resourceUsage;
}
