package com.example.dbjobs.service;

import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;

/**
 * 探测一次数据库能力，结果缓存在 ConnectionProfile.capabilities
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapabilityDetector {
    private static final Map<String, String> FEATURE_KEYS = Map.of(
            "transactions", "supports_transactions",
            "stored_procedures", "supports_stored_procedures",
            "views", "supports_views",
            "materialized_views", "supports_materialized_views",
            "json", "supports_json",
            "full_text_search", "supports_full_text_search");

    private final ConnectionManager connectionManager;
    private final ConnectionProfileRepository profileRepo;

    /**
     * 探测失败直接抛出，不写默认值
     */
    public DatabaseCapabilities detectAndSave(ConnectionProfile profile) {
        try {
            Connector connector = connectionManager.getConnector(profile);
            DatabaseCapabilities capabilities = connector.detectCapabilities();
            profile.setCapabilities(capabilities.toMap());
            profileRepo.save(profile);
            log.info("能力探测完成 {}: {}", profile.getName(), capabilities.getVersion());
            return capabilities;
        } catch (RuntimeException e) {
            log.error("能力探测失败 {}: {}", profile.getName(), e.getMessage());
            throw e;
        }
    }

    public Map<String, Object> getCachedCapabilities(ConnectionProfile profile) {
        return profile.getCapabilities() == null ? Collections.emptyMap() : profile.getCapabilities();
    }

    public boolean supportsFeature(ConnectionProfile profile, String feature) {
        String key = FEATURE_KEYS.get(feature);
        if (key == null) {
            return false;
        }
        return Boolean.TRUE.equals(getCachedCapabilities(profile).get(key));
    }
}
