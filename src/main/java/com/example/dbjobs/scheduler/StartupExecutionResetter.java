package com.example.dbjobs.scheduler;

import com.example.dbjobs.enums.ExecutionStatus;
import com.example.dbjobs.repository.JobExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * 启动时的"清洁工"
 * 上次停机时还在 PENDING / RUNNING 的执行不可能再结束，统一置为 FAILED
 */
@Component
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class StartupExecutionResetter implements ApplicationRunner {

    static final String INTERRUPTED_MESSAGE = "Execution interrupted by service restart";

    private final JobExecutionRepository executionRepo;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        log.info(">>> 系统启动，开始检查异常中断的执行...");
        int count = executionRepo.failInterrupted(
                List.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING),
                ExecutionStatus.FAILED, clock.instant(), INTERRUPTED_MESSAGE);
        if (count > 0) {
            log.warn("检测到 {} 个执行在上次停机时中断，已置为 FAILED。", count);
        }
        log.info("<<< 异常执行清理完毕，调度器准备就绪。");
    }
}
