package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.exception.ExecutionCancelledException;
import com.example.dbjobs.util.SensitiveDataSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.helpers.MessageFormatter;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行器公共部分：
 * 校验 -> doExecute -> 汇总日志与资源占用；日志缓冲格式 "[timestamp] [LEVEL] message"
 */
@Slf4j
public abstract class AbstractJobExecutor implements JobExecutor {

    protected final ExecutionContext context;
    protected final Map<String, Object> config;

    private final List<String> logs = new ArrayList<>();
    private int statementCount;

    protected AbstractJobExecutor(ExecutionContext context) {
        this.context = context;
        this.config = context.getConfig() == null ? new LinkedHashMap<>() : context.getConfig();
    }

    @Override
    public ExecutionResult execute(Long executionId) {
        long startMillis = System.currentTimeMillis();
        long cpuStart = threadCpuNanos();
        logInfo("Starting {} execution {}", getJobType(), executionId);

        ValidationResult validation = validateConfig();
        if (!validation.isValid()) {
            return failure("Validation failed: " + String.join(", ", validation.getErrors()), null);
        }
        for (String warning : validation.getWarnings()) {
            logWarn(warning);
        }

        ExecutionResult result;
        try {
            result = doExecute(executionId);
        } finally {
            if (context.getControl() != null) {
                context.getControl().clearCancelHook(executionId);
            }
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("duration_ms", System.currentTimeMillis() - startMillis);
        usage.put("statement_count", statementCount);
        long cpuEnd = threadCpuNanos();
        if (cpuStart >= 0 && cpuEnd >= 0) {
            usage.put("cpu_time_ms", (cpuEnd - cpuStart) / 1_000_000);
        }
        result.setResourceUsage(usage);
        result.setExecutionLog(getLogs());
        return result;
    }

    protected abstract ExecutionResult doExecute(Long executionId);

    private static long threadCpuNanos() {
        ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        return bean.isCurrentThreadCpuTimeSupported() ? bean.getCurrentThreadCpuTime() : -1;
    }

    protected void countStatement() {
        statementCount++;
    }

    // ---------------- 日志缓冲 ----------------

    protected void logInfo(String pattern, Object... args) {
        String message = MessageFormatter.arrayFormat(pattern, args).getMessage();
        log.info(message);
        append("INFO", message);
    }

    protected void logWarn(String pattern, Object... args) {
        String message = MessageFormatter.arrayFormat(pattern, args).getMessage();
        log.warn(message);
        append("WARN", message);
    }

    protected void logError(String pattern, Object... args) {
        String message = MessageFormatter.arrayFormat(pattern, args).getMessage();
        log.error(message);
        append("ERROR", message);
    }

    private void append(String level, String message) {
        logs.add("[" + context.getClock().instant() + "] [" + level + "] " + message);
    }

    public String getLogs() {
        return String.join("\n", logs);
    }

    protected Object sanitize(Object data) {
        return SensitiveDataSanitizer.sanitize(data);
    }

    // ---------------- 取消 ----------------

    protected void checkCancelled(Long executionId) {
        if (context.getControl() != null) {
            context.getControl().checkCancelled(executionId);
        }
    }

    protected boolean isCancelled(Long executionId) {
        return context.getControl() != null && context.getControl().isCancelled(executionId);
    }

    protected void onCancel(Long executionId, Runnable hook) {
        if (context.getControl() != null) {
            context.getControl().registerCancelHook(executionId, hook);
        }
    }

    // ---------------- 结果 ----------------

    protected ExecutionResult failure(String message, Throwable error) {
        return ExecutionResult.builder()
                .success(false)
                .errorMessage(message)
                .errorTrace(error == null ? null : ExceptionUtils.getStackTrace(error))
                .executionLog(getLogs())
                .build();
    }

    /**
     * 语句被取消打断时 JDBC 也会抛 SQLException，这种情况按取消处理
     */
    protected ExecutionResult sqlFailure(Long executionId, String what, SQLException e) {
        if (isCancelled(executionId)) {
            logWarn("{} cancelled", what);
            throw new ExecutionCancelledException("执行 [" + executionId + "] 已被取消");
        }
        logError("{} error: {}", what, e.getMessage());
        return failure(e.getMessage(), e);
    }

    protected void rollbackQuietly(Connection conn) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
                logInfo("Transaction rolled back");
            }
        } catch (SQLException e) {
            logWarn("Rollback failed: {}", e.getMessage());
        }
    }

    protected void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
            logInfo("Database connection closed");
        } catch (SQLException e) {
            logWarn("Closing connection failed: {}", e.getMessage());
        }
    }
}
