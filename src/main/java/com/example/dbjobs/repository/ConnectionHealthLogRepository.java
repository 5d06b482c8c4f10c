package com.example.dbjobs.repository;

import com.example.dbjobs.entity.ConnectionHealthLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * 健康检查流水 (只追加)
 */
@Repository
public interface ConnectionHealthLogRepository extends JpaRepository<ConnectionHealthLog, Long> {

    List<ConnectionHealthLog> findByConnectionIdAndTimestampGreaterThanEqualOrderByTimestampDesc(Long connectionId, Instant since);
}
