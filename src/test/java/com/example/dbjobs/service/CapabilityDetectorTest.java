package com.example.dbjobs.service;

import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.exception.ConnectionException;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CapabilityDetectorTest {

    @Mock private ConnectionManager connectionManager;
    @Mock private ConnectionProfileRepository profileRepo;
    @Mock private Connector connector;

    @InjectMocks
    private CapabilityDetector detector;

    @Test
    @DisplayName("探测结果缓存到连接档案")
    void detectAndSave() {
        ConnectionProfile profile = new ConnectionProfile();
        profile.setName("pg");
        when(connectionManager.getConnector(profile)).thenReturn(connector);
        when(connector.detectCapabilities()).thenReturn(DatabaseCapabilities.builder()
                .version("PostgreSQL 16.2")
                .supportsTransactions(true)
                .supportsJson(true)
                .maxConnections(100)
                .extensions(List.of("pg_trgm"))
                .build());

        detector.detectAndSave(profile);

        verify(profileRepo).save(profile);
        assertEquals("PostgreSQL 16.2", profile.getCapabilities().get("version"));
        assertTrue(detector.supportsFeature(profile, "transactions"));
        assertTrue(detector.supportsFeature(profile, "json"));
        assertFalse(detector.supportsFeature(profile, "materialized_views"));
        assertFalse(detector.supportsFeature(profile, "time_travel"));
    }

    @Test
    @DisplayName("从未探测过返回空")
    void neverDetected() {
        ConnectionProfile profile = new ConnectionProfile();
        assertTrue(detector.getCachedCapabilities(profile).isEmpty());
        assertFalse(detector.supportsFeature(profile, "transactions"));
    }

    @Test
    @DisplayName("探测失败向上抛，不写默认值")
    void detectFailurePropagates() {
        ConnectionProfile profile = new ConnectionProfile();
        profile.setName("pg");
        when(connectionManager.getConnector(profile)).thenThrow(new ConnectionException("down"));

        assertThrows(ConnectionException.class, () -> detector.detectAndSave(profile));
        verify(profileRepo, never()).save(any());
        assertNull(profile.getCapabilities());
    }
}
