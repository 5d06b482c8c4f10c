package com.example.dbjobs.repository;

import com.example.dbjobs.entity.ConnectionProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 目标库连接档案
 */
@Repository
public interface ConnectionProfileRepository extends JpaRepository<ConnectionProfile, Long> {

    /**
     * 用途: HealthMonitor 巡检所有启用的连接
     */
    List<ConnectionProfile> findByActiveTrue();
}
