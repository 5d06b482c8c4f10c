package com.example.dbjobs.service;

import com.example.dbjobs.config.AppProperties;
import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.HealthDashboard;
import com.example.dbjobs.entity.ConnectionHealthLog;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.enums.HealthStatus;
import com.example.dbjobs.repository.ConnectionHealthLogRepository;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 连接健康巡检
 * 成功 -> ONLINE 并清零失败计数；失败累计未到阈值 -> DEGRADED，到阈值 -> OFFLINE；探活抛异常直接 OFFLINE
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthMonitor {
    public static final String CHECKED_BY_SYSTEM = "system";
    public static final String CHECKED_BY_USER = "user";
    public static final String CHECKED_BY_SCHEDULER = "scheduler";

    private final ConnectionManager connectionManager;
    private final ConnectionProfileRepository profileRepo;
    private final ConnectionHealthLogRepository healthLogRepo;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * 巡检全部启用的连接；单个连接出错不影响其它连接
     */
    public void monitorAllConnections() {
        List<ConnectionProfile> profiles = profileRepo.findByActiveTrue();
        for (ConnectionProfile profile : profiles) {
            checkConnection(profile, CHECKED_BY_SCHEDULER);
        }
    }

    public HealthStatus checkConnection(ConnectionProfile profile) {
        return checkConnection(profile, CHECKED_BY_SYSTEM);
    }

    public HealthStatus checkConnection(ConnectionProfile profile, String checkedBy) {
        HealthStatus newStatus;
        long responseTimeMs;
        String errorMessage;
        Instant checkedAt;
        try {
            Connector connector = connectionManager.getConnector(profile);
            HealthCheckResult result = connector.testConnection();
            if (result.isHealthy()) {
                newStatus = HealthStatus.ONLINE;
                profile.setFailedAttempts(0);
            } else {
                profile.setFailedAttempts(profile.getFailedAttempts() + 1);
                newStatus = profile.getFailedAttempts() >= appProperties.getHealth().getOfflineThreshold()
                        ? HealthStatus.OFFLINE : HealthStatus.DEGRADED;
            }
            responseTimeMs = result.getResponseTimeMs();
            errorMessage = result.getErrorMessage();
            checkedAt = result.getTimestamp() != null ? result.getTimestamp() : clock.instant();
            log.info("健康检查 {}: {} ({}ms)", profile.getName(), newStatus, responseTimeMs);
        } catch (RuntimeException e) {
            log.error("健康检查异常 {}: {}", profile.getName(), e.getMessage());
            newStatus = HealthStatus.OFFLINE;
            profile.setFailedAttempts(profile.getFailedAttempts() + 1);
            responseTimeMs = 0;
            errorMessage = e.getMessage();
            checkedAt = clock.instant();
        }

        profile.setHealthStatus(newStatus);
        profile.setLastHealthCheck(checkedAt);
        profile.setResponseTimeMs((int) responseTimeMs);
        profileRepo.save(profile);

        logHealthStatus(profile.getId(), newStatus, (int) responseTimeMs, errorMessage, checkedBy, checkedAt);

        if (newStatus == HealthStatus.OFFLINE) {
            alertOnFailure(profile);
        }
        return newStatus;
    }

    public ConnectionHealthLog logHealthStatus(Long connectionId, HealthStatus status, int responseTimeMs,
                                               String errorMessage, String checkedBy, Instant timestamp) {
        ConnectionHealthLog entry = new ConnectionHealthLog();
        entry.setConnectionId(connectionId);
        entry.setStatus(status);
        entry.setResponseTimeMs(responseTimeMs);
        entry.setErrorMessage(errorMessage);
        entry.setCheckedBy(checkedBy);
        entry.setTimestamp(timestamp);
        return healthLogRepo.save(entry);
    }

    /**
     * 最近 hours 小时的检查记录，新的在前
     */
    public List<ConnectionHealthLog> getHealthHistory(Long connectionId, int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return healthLogRepo.findByConnectionIdAndTimestampGreaterThanEqualOrderByTimestampDesc(connectionId, since);
    }

    public HealthDashboard getDashboard() {
        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            counts.put(status, 0L);
        }
        List<HealthDashboard.ConnectionHealth> rows = new ArrayList<>();
        for (ConnectionProfile profile : profileRepo.findByActiveTrue()) {
            HealthStatus status = profile.getHealthStatus() == null ? HealthStatus.UNKNOWN : profile.getHealthStatus();
            counts.merge(status, 1L, Long::sum);
            rows.add(new HealthDashboard.ConnectionHealth(profile.getId(), profile.getName(), status,
                    profile.getResponseTimeMs(), profile.getFailedAttempts(), profile.getLastHealthCheck()));
        }
        return new HealthDashboard(clock.instant(), counts, rows);
    }

    // 目前只打告警日志，没有外发通道
    void alertOnFailure(ConnectionProfile profile) {
        log.warn("ALERT: 连接 {} 已离线，连续失败 {} 次", profile.getName(), profile.getFailedAttempts());
    }
}
