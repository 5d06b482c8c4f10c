package com.example.dbjobs.repository;

import com.example.dbjobs.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    /**
     * 到期的定时作业
     * 用途: JobDispatcher 每次轮询抓取 next_run_at <= now 的启用作业
     */
    List<ScheduledJob> findByActiveTrueAndCronExpressionIsNotNullAndNextRunAtLessThanEqual(Instant now);

    /**
     * 到期的重试
     */
    List<ScheduledJob> findByActiveTrueAndNextRetryAtLessThanEqual(Instant now);

    /**
     * 删除连接前检查是否还有作业引用
     */
    long countByConnectionId(Long connectionId);
}
