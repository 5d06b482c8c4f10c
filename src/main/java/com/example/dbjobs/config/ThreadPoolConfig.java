package com.example.dbjobs.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class ThreadPoolConfig {

    private final AppProperties appProperties;

    // ==========================================
    // 1. 作业执行线程池：备份/脚本都是阻塞 IO，和调度线程隔离
    // ==========================================
    @Bean("jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor() {
        AppProperties.PoolSize size = appProperties.getThreadPool().getJob();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size.getCorePoolSize() > 0 ? size.getCorePoolSize() : 4);
        executor.setMaxPoolSize(size.getMaxPoolSize() > 0 ? size.getMaxPoolSize() : 8);
        executor.setQueueCapacity(size.getQueueCapacity());
        executor.setThreadNamePrefix("Job-Exec-");
        // 队列满了直接拒绝，由调度器下一轮再捡 (CallerRuns 会阻塞调度线程)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // ==========================================
    // 2. 健康巡检线程池
    // ==========================================
    @Bean("healthExecutor")
    public ThreadPoolTaskExecutor healthExecutor() {
        AppProperties.PoolSize size = appProperties.getThreadPool().getHealth();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size.getCorePoolSize() > 0 ? size.getCorePoolSize() : 2);
        executor.setMaxPoolSize(size.getMaxPoolSize() > 0 ? size.getMaxPoolSize() : 4);
        executor.setQueueCapacity(size.getQueueCapacity());
        executor.setThreadNamePrefix("Health-Check-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 所有时间计算都走这个时钟 (UTC)，测试里替换成固定时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
