package com.example.dbjobs.service;

import com.example.dbjobs.config.AppProperties;
import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.HealthDashboard;
import com.example.dbjobs.entity.ConnectionHealthLog;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.enums.HealthStatus;
import com.example.dbjobs.exception.ConnectionException;
import com.example.dbjobs.repository.ConnectionHealthLogRepository;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthMonitorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

    @Mock private ConnectionManager connectionManager;
    @Mock private ConnectionProfileRepository profileRepo;
    @Mock private ConnectionHealthLogRepository healthLogRepo;
    @Mock private Connector connector;

    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new HealthMonitor(connectionManager, profileRepo, healthLogRepo, new AppProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ConnectionProfile profile(long id) {
        ConnectionProfile profile = new ConnectionProfile();
        profile.setId(id);
        profile.setName("conn-" + id);
        profile.setActive(true);
        return profile;
    }

    @Test
    @DisplayName("探活成功: ONLINE 并清零失败次数")
    void healthy() {
        ConnectionProfile profile = profile(1);
        profile.setFailedAttempts(2);
        when(connectionManager.getConnector(profile)).thenReturn(connector);
        when(connector.testConnection()).thenReturn(new HealthCheckResult(true, 15, null, NOW));

        assertEquals(HealthStatus.ONLINE, monitor.checkConnection(profile, HealthMonitor.CHECKED_BY_USER));
        assertEquals(0, profile.getFailedAttempts());
        assertEquals(15, profile.getResponseTimeMs());
        assertEquals(NOW, profile.getLastHealthCheck());
        verify(profileRepo).save(profile);

        ArgumentCaptor<ConnectionHealthLog> captor = ArgumentCaptor.forClass(ConnectionHealthLog.class);
        verify(healthLogRepo).save(captor.capture());
        assertEquals(HealthStatus.ONLINE, captor.getValue().getStatus());
        assertEquals("user", captor.getValue().getCheckedBy());
    }

    @Test
    @DisplayName("探活失败未到阈值 DEGRADED，到阈值 OFFLINE")
    void degradedThenOffline() {
        ConnectionProfile profile = profile(1);
        when(connectionManager.getConnector(profile)).thenReturn(connector);
        when(connector.testConnection()).thenReturn(new HealthCheckResult(false, 30, "timeout", NOW));

        assertEquals(HealthStatus.DEGRADED, monitor.checkConnection(profile));
        assertEquals(HealthStatus.DEGRADED, monitor.checkConnection(profile));
        assertEquals(HealthStatus.OFFLINE, monitor.checkConnection(profile));
        assertEquals(3, profile.getFailedAttempts());
        verify(healthLogRepo, times(3)).save(any());
    }

    @Test
    @DisplayName("获取连接器抛异常直接 OFFLINE，仍然写日志")
    void exceptionMeansOffline() {
        ConnectionProfile profile = profile(1);
        when(connectionManager.getConnector(profile)).thenThrow(new ConnectionException("refused"));

        assertEquals(HealthStatus.OFFLINE, monitor.checkConnection(profile));
        assertEquals(1, profile.getFailedAttempts());

        ArgumentCaptor<ConnectionHealthLog> captor = ArgumentCaptor.forClass(ConnectionHealthLog.class);
        verify(healthLogRepo).save(captor.capture());
        assertEquals("refused", captor.getValue().getErrorMessage());
        assertEquals("system", captor.getValue().getCheckedBy());
    }

    @Test
    @DisplayName("巡检所有启用的连接，单个失败不影响其它")
    void monitorAll() {
        ConnectionProfile ok = profile(1);
        ConnectionProfile bad = profile(2);
        when(profileRepo.findByActiveTrue()).thenReturn(List.of(bad, ok));
        when(connectionManager.getConnector(bad)).thenThrow(new ConnectionException("down"));
        when(connectionManager.getConnector(ok)).thenReturn(connector);
        when(connector.testConnection()).thenReturn(HealthCheckResult.healthy(5));

        monitor.monitorAllConnections();

        assertEquals(HealthStatus.OFFLINE, bad.getHealthStatus());
        assertEquals(HealthStatus.ONLINE, ok.getHealthStatus());
        verify(healthLogRepo, times(2)).save(any());
    }

    @Test
    @DisplayName("历史记录按小时窗口查询")
    void history() {
        monitor.getHealthHistory(1L, 24);
        verify(healthLogRepo).findByConnectionIdAndTimestampGreaterThanEqualOrderByTimestampDesc(
                eq(1L), eq(Instant.parse("2026-01-31T08:00:00Z")));
    }

    @Test
    @DisplayName("看板按状态计数")
    void dashboard() {
        ConnectionProfile online = profile(1);
        online.setHealthStatus(HealthStatus.ONLINE);
        ConnectionProfile unknown = profile(2);
        when(profileRepo.findByActiveTrue()).thenReturn(List.of(online, unknown));

        HealthDashboard dashboard = monitor.getDashboard();

        assertEquals(1L, dashboard.getStatusCounts().get(HealthStatus.ONLINE));
        assertEquals(1L, dashboard.getStatusCounts().get(HealthStatus.UNKNOWN));
        assertEquals(0L, dashboard.getStatusCounts().get(HealthStatus.OFFLINE));
        assertEquals(2, dashboard.getConnections().size());
    }
}
