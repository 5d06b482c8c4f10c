package com.example.dbjobs.repository;

import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.enums.ExecutionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, Long> {

    Page<JobExecution> findByJobIdOrderByIdDesc(Long jobId, Pageable pageable);

    List<JobExecution> findByStatusIn(Collection<ExecutionStatus> statuses);

    /**
     * 作业删除时级联清理执行记录
     */
    @Modifying
    @Query("DELETE FROM JobExecution e WHERE e.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);

    /**
     * 启动时把上次宕机留下的 PENDING/RUNNING 记录置为失败
     */
    @Modifying
    @Query("UPDATE JobExecution e SET e.status = :target, e.completedAt = :now, e.errorMessage = :msg " +
            "WHERE e.status IN :statuses")
    int failInterrupted(@Param("statuses") Collection<ExecutionStatus> statuses,
                        @Param("target") ExecutionStatus target,
                        @Param("now") Instant now,
                        @Param("msg") String msg);
}
