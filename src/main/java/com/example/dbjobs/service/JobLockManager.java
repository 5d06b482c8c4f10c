package com.example.dbjobs.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 作业级互斥：同一个作业同一时刻只允许一个执行
 */
@Component
public class JobLockManager {

    private final Set<Long> runningJobIds = ConcurrentHashMap.newKeySet();

    /**
     * @return true 锁定成功, false 作业已在执行
     */
    public boolean tryLock(Long jobId) {
        return runningJobIds.add(jobId);
    }

    public void releaseLock(Long jobId) {
        runningJobIds.remove(jobId);
    }

    public boolean isLocked(Long jobId) {
        return runningJobIds.contains(jobId);
    }
}
