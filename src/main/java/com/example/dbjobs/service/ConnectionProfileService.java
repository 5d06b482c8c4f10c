package com.example.dbjobs.service;

import com.example.dbjobs.dto.ConnectionRequest;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.exception.ResourceNotFoundException;
import com.example.dbjobs.repository.ConnectionProfileRepository;
import com.example.dbjobs.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 连接档案维护；密码和连接串只以密文入库
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionProfileService {

    private final ConnectionProfileRepository profileRepo;
    private final ScheduledJobRepository jobRepo;
    private final SecretCipher secretCipher;
    private final ConnectionManager connectionManager;

    public ConnectionProfile get(Long id) {
        return profileRepo.findById(id).orElseThrow(() -> new ResourceNotFoundException("Connection not found: " + id));
    }

    public List<ConnectionProfile> list() {
        return profileRepo.findAll();
    }

    @Transactional
    public ConnectionProfile create(ConnectionRequest request, Long actorId) {
        if (StringUtils.isBlank(request.getName())) {
            throw new ConfigurationException("Connection name is required");
        }
        if (request.getDbType() == null) {
            throw new ConfigurationException("Database type is required");
        }
        ConnectionProfile profile = new ConnectionProfile();
        profile.setActive(true);
        apply(profile, request);
        profile.setCreatedBy(actorId);
        ConnectionProfile saved = profileRepo.save(profile);
        log.info("连接[{}] {} 已创建 ({})", saved.getId(), saved.getName(), saved.getDbType());
        return saved;
    }

    /**
     * 修改后丢弃缓存的连接器，下次使用时按新配置重建
     */
    @Transactional
    public ConnectionProfile update(Long id, ConnectionRequest request) {
        ConnectionProfile profile = get(id);
        apply(profile, request);
        ConnectionProfile saved = profileRepo.save(profile);
        connectionManager.closeConnection(id);
        return saved;
    }

    /**
     * 仍有作业引用时拒绝删除
     */
    @Transactional
    public void delete(Long id) {
        ConnectionProfile profile = get(id);
        long dependents = jobRepo.countByConnectionId(id);
        if (dependents > 0) {
            throw new ConfigurationException("Connection " + profile.getName() + " is referenced by "
                    + dependents + " job(s); delete them first");
        }
        connectionManager.closeConnection(id);
        profileRepo.delete(profile);
        log.info("连接[{}] {} 已删除", id, profile.getName());
    }

    /**
     * 用未保存的配置试连一次
     */
    public HealthCheckResult test(ConnectionRequest request) {
        ConnectionProfile draft = new ConnectionProfile();
        apply(draft, request);
        return connectionManager.testConfiguration(draft, request.getPassword(), request.getConnectionString());
    }

    public List<String> discoverDatabases(ConnectionRequest request) {
        ConnectionProfile draft = new ConnectionProfile();
        apply(draft, request);
        return connectionManager.discoverDatabases(draft, request.getPassword(), request.getConnectionString());
    }

    private void apply(ConnectionProfile profile, ConnectionRequest request) {
        if (request.getName() != null) profile.setName(request.getName());
        if (request.getDescription() != null) profile.setDescription(request.getDescription());
        if (request.getDbType() != null) profile.setDbType(request.getDbType());
        if (request.getHost() != null) profile.setHost(request.getHost());
        if (request.getPort() != null) profile.setPort(request.getPort());
        if (request.getDatabaseName() != null) profile.setDatabaseName(request.getDatabaseName());
        if (request.getUsername() != null) profile.setUsername(request.getUsername());
        if (request.getSchemaName() != null) profile.setSchemaName(request.getSchemaName());
        if (request.getPoolSize() != null) profile.setPoolSize(request.getPoolSize());
        if (request.getMaxConnections() != null) profile.setMaxConnections(request.getMaxConnections());
        if (request.getTimeoutSeconds() != null) profile.setTimeoutSeconds(request.getTimeoutSeconds());
        if (request.getConnectionMode() != null) profile.setConnectionMode(request.getConnectionMode());
        if (request.getSslEnabled() != null) profile.setSslEnabled(request.getSslEnabled());
        if (request.getSslCertPath() != null) profile.setSslCertPath(request.getSslCertPath());
        if (request.getSslKeyPath() != null) profile.setSslKeyPath(request.getSslKeyPath());
        if (request.getSslCaPath() != null) profile.setSslCaPath(request.getSslCaPath());
        if (request.getActive() != null) profile.setActive(request.getActive());
        if (request.getDefaultProfile() != null) profile.setDefaultProfile(request.getDefaultProfile());
        if (StringUtils.isNotEmpty(request.getPassword())) {
            profile.setEncryptedPassword(secretCipher.encrypt(request.getPassword()));
        }
        if (StringUtils.isNotBlank(request.getConnectionString())) {
            profile.setEncryptedConnectionString(secretCipher.encrypt(request.getConnectionString().trim()));
        }
    }
}
