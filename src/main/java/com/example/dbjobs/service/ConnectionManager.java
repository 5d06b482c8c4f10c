package com.example.dbjobs.service;

import com.example.dbjobs.config.AppProperties;
import com.example.dbjobs.connector.Connector;
import com.example.dbjobs.connector.ConnectorFactory;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.entity.ConnectionProfile;
import com.example.dbjobs.enums.ConnectionMode;
import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.util.ConnectionUrls;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 连接器注册表：connectionId -> 已连接的 Connector
 * <p>
 * 同一个 connectionId 最多只有一个活的连接器；
 * 创建过程按 id 加锁，不同 id 之间互不阻塞
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionManager {
    private final ConnectorFactory connectorFactory;
    private final SecretCipher secretCipher;
    private final AppProperties appProperties;

    private final Map<Long, Connector> connectors = new ConcurrentHashMap<>();
    private final Map<Long, String> connectionNames = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Connector getConnector(ConnectionProfile profile) {
        return getConnector(profile, null);
    }

    /**
     * 获取缓存的连接器；不存在则新建并连接，已断开则重连
     *
     * @param decryptedPassword 可选，调用方已经解密过时直接传入
     */
    public Connector getConnector(ConnectionProfile profile, String decryptedPassword) {
        Long id = profile.getId();
        Connector cached = connectors.get(id);
        if (cached != null && cached.isConnected()) {
            return cached;
        }

        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
            lock.lock();
            try {
                if (locks.get(id) != lock) {
                    // 等锁期间被 closeConnection 释放了，换新锁重来
                    continue;
                }
                // 拿到锁后再查一次，可能已被其它线程建好
                cached = connectors.get(id);
                if (cached != null) {
                    if (!cached.isConnected()) {
                        log.info("连接器已断开，重新连接: {} (ID: {})", profile.getName(), id);
                        cached.connect();
                    }
                    return cached;
                }

                ConnectionTarget target = resolveTarget(profile, decryptedPassword, null,
                        profile.getPoolSize(), profile.getTimeoutSeconds());
                Connector connector = connectorFactory.create(target);
                try {
                    connector.connect();
                } catch (RuntimeException e) {
                    log.error("连接失败: {} (ID: {}): {}", profile.getName(), id, e.getMessage());
                    locks.remove(id, lock);
                    throw e;
                }
                connectors.put(id, connector);
                connectionNames.put(id, profile.getName());
                log.info("已连接: {} (ID: {})", profile.getName(), id);
                return connector;
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * 不进缓存的临时连接器 (测试配置 / 发现库)，调用方负责 disconnect
     */
    public Connector createTempConnector(ConnectionProfile profile, String decryptedPassword, String connectionString) {
        AppProperties.Connector cfg = appProperties.getConnector();
        ConnectionTarget target = resolveTarget(profile, decryptedPassword, connectionString,
                cfg.getTempPoolSize(), cfg.getTempTimeoutSeconds());
        Connector connector = connectorFactory.create(target);
        connector.connect();
        return connector;
    }

    public ConnectionTarget resolveTarget(ConnectionProfile profile) {
        return resolveTarget(profile, null, null, profile.getPoolSize(), profile.getTimeoutSeconds());
    }

    /**
     * 解密并组装连接信息；完整连接串优先于 host/port/user/password
     */
    ConnectionTarget resolveTarget(ConnectionProfile profile, String decryptedPassword, String connectionString,
                                   int poolSize, int timeoutSeconds) {
        if (profile.getDbType() == null) {
            throw new ConfigurationException("Database type is required for connection " + profile.getName());
        }
        String password = decryptedPassword;
        if (password == null && StringUtils.isNotEmpty(profile.getEncryptedPassword())) {
            password = secretCipher.decrypt(profile.getEncryptedPassword())
                    .orElseThrow(() -> new ConfigurationException(
                            "Stored password for connection " + profile.getName() + " cannot be decrypted"));
        }
        String uri = connectionString;
        if (StringUtils.isBlank(uri) && StringUtils.isNotEmpty(profile.getEncryptedConnectionString())) {
            uri = secretCipher.decrypt(profile.getEncryptedConnectionString())
                    .orElseThrow(() -> new ConfigurationException(
                            "Stored connection string for connection " + profile.getName() + " cannot be decrypted"));
        }

        ConnectionTarget.ConnectionTargetBuilder builder = ConnectionTarget.builder()
                .dbType(profile.getDbType())
                .host(profile.getHost())
                .port(profile.getPort() == null || profile.getPort() <= 0
                        ? profile.getDbType().getDefaultPort() : profile.getPort())
                .database(profile.getDatabaseName())
                .username(profile.getUsername())
                .password(password)
                .poolSize(poolSize)
                .timeoutSeconds(timeoutSeconds)
                .readOnly(profile.getConnectionMode() == ConnectionMode.READ_ONLY)
                .sslEnabled(profile.isSslEnabled())
                .sslCertPath(profile.getSslCertPath())
                .sslKeyPath(profile.getSslKeyPath())
                .sslCaPath(profile.getSslCaPath());

        if (StringUtils.isNotBlank(uri)) {
            ConnectionUrls.Parsed parsed = ConnectionUrls.parse(profile.getDbType(), uri);
            builder.url(parsed.getUrl());
            if (parsed.getUsername() != null) {
                builder.username(parsed.getUsername());
            }
            if (parsed.getPassword() != null) {
                builder.password(parsed.getPassword());
            }
            if (parsed.getHost() != null) {
                builder.host(parsed.getHost());
            }
            if (parsed.getPort() != null) {
                builder.port(parsed.getPort());
            }
            if (StringUtils.isNotBlank(parsed.getDatabase())) {
                builder.database(parsed.getDatabase());
            }
        } else {
            builder.url(ConnectionUrls.build(profile.getDbType(), profile.getHost(), profile.getPort(),
                    profile.getDatabaseName(), profile.getUsername(), password));
        }
        return builder.build();
    }

    /**
     * 关闭并移出缓存，同时释放该 id 的锁；未缓存的 id 什么也不做
     */
    public void closeConnection(Long connectionId) {
        ReentrantLock lock = locks.get(connectionId);
        if (lock == null) {
            return;
        }
        lock.lock();
        try {
            Connector connector = connectors.remove(connectionId);
            connectionNames.remove(connectionId);
            locks.remove(connectionId, lock);
            if (connector != null) {
                connector.disconnect();
                log.info("已关闭连接 ID: {}", connectionId);
            }
        } finally {
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    @PreDestroy
    public void closeAllConnections() {
        for (Long id : List.copyOf(connectors.keySet())) {
            closeConnection(id);
        }
        log.info("已关闭全部连接");
    }

    /**
     * 只对已缓存的连接器探活，未缓存返回 empty
     */
    public Optional<HealthCheckResult> healthCheck(Long connectionId) {
        Connector connector = connectors.get(connectionId);
        if (connector == null) {
            return Optional.empty();
        }
        return Optional.of(connector.testConnection());
    }

    /**
     * 清理已断开的连接器
     *
     * @return 清理数量
     */
    public int cleanupIdleConnections() {
        int cleaned = 0;
        for (Map.Entry<Long, Connector> entry : List.copyOf(connectors.entrySet())) {
            if (!entry.getValue().isConnected()) {
                closeConnection(entry.getKey());
                cleaned++;
            }
        }
        if (cleaned > 0) {
            log.info("清理了 {} 个空闲连接", cleaned);
        }
        return cleaned;
    }

    public Map<Long, String> getActiveConnections() {
        return new LinkedHashMap<>(connectionNames);
    }

    /**
     * 保存前测试配置，用临时连接器，结束后一定断开
     */
    public HealthCheckResult testConfiguration(ConnectionProfile profile, String decryptedPassword, String connectionString) {
        long start = System.currentTimeMillis();
        Connector connector;
        try {
            connector = createTempConnector(profile, decryptedPassword, connectionString);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("测试连接失败: {}: {}", profile.getName(), e.getMessage());
            return HealthCheckResult.unhealthy(System.currentTimeMillis() - start, e.getMessage());
        }
        try {
            return connector.testConnection();
        } finally {
            connector.disconnect();
        }
    }

    /**
     * 列出服务器上的数据库，用临时连接器
     */
    public List<String> discoverDatabases(ConnectionProfile profile, String decryptedPassword, String connectionString) {
        Connector connector = createTempConnector(profile, decryptedPassword, connectionString);
        try {
            return connector.listDatabases();
        } finally {
            connector.disconnect();
        }
    }
}
