package com.example.dbjobs.service;

import com.example.dbjobs.exception.ExecutionCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 执行的取消信号
 * <p>
 * 执行器在关键步骤之间调用 {@link #checkCancelled(Long)}；
 * 正在阻塞的调用 (语句执行、备份子进程) 通过登记的 hook 打断
 */
@Slf4j
@Component
public class ExecutionControlManager {

    private final Set<Long> cancelledExecutionIds = ConcurrentHashMap.newKeySet();
    private final Map<Long, Runnable> cancelHooks = new ConcurrentHashMap<>();

    public void cancel(Long executionId) {
        cancelledExecutionIds.add(executionId);
        Runnable hook = cancelHooks.get(executionId);
        if (hook != null) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("执行[{}] 取消回调失败: {}", executionId, e.getMessage());
            }
        }
    }

    public boolean isCancelled(Long executionId) {
        return cancelledExecutionIds.contains(executionId);
    }

    public void checkCancelled(Long executionId) {
        if (isCancelled(executionId)) {
            throw new ExecutionCancelledException("执行 [" + executionId + "] 已被取消");
        }
    }

    /**
     * 登记当前阻塞调用的打断方式，替换之前的登记
     */
    public void registerCancelHook(Long executionId, Runnable hook) {
        cancelHooks.put(executionId, hook);
    }

    public void clearCancelHook(Long executionId) {
        cancelHooks.remove(executionId);
    }

    /**
     * 执行结束后清理
     */
    public void release(Long executionId) {
        cancelHooks.remove(executionId);
        cancelledExecutionIds.remove(executionId);
    }
}
