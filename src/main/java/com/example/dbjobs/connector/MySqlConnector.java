package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.enums.DatabaseType;
import com.zaxxer.hikari.HikariConfig;
import org.apache.commons.lang3.StringUtils;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MySQL / MariaDB 共用
 * MySQL 没有独立的 schema 层，schema 即 database，对应 JDBC 的 catalog
 */
public class MySqlConnector extends AbstractJdbcConnector {

    private static final Set<String> SYSTEM_SCHEMAS = Set.of("information_schema", "performance_schema", "mysql", "sys");

    private final DatabaseType type;

    public MySqlConnector(ConnectionTarget target) {
        super(target);
        this.type = target.getDbType() == DatabaseType.MARIADB ? DatabaseType.MARIADB : DatabaseType.MYSQL;
    }

    @Override
    public DatabaseType getDatabaseType() {
        return type;
    }

    @Override
    protected void customize(HikariConfig config) {
        if (target.isSslEnabled()) {
            config.addDataSourceProperty("sslMode", StringUtils.isNotBlank(target.getSslCaPath()) ? "VERIFY_CA" : "REQUIRED");
        }
    }

    @Override
    protected String catalogOf(String schema) {
        return StringUtils.isNotBlank(schema) ? schema : target.getDatabase();
    }

    @Override
    protected String schemaPatternOf(String schema) {
        return null;
    }

    @Override
    public List<String> listDatabases() {
        try {
            return queryForList("SHOW DATABASES").stream()
                    .filter(db -> !SYSTEM_SCHEMAS.contains(db.toLowerCase()))
                    .collect(Collectors.toList());
        } catch (SQLException e) {
            throw translate("listDatabases", e);
        }
    }

    @Override
    public List<String> listSchemas() {
        return listDatabases();
    }

    @Override
    public DatabaseCapabilities detectCapabilities() {
        try {
            String version = queryForString("SELECT VERSION()");
            String maxConnections = queryForString("SELECT @@max_connections");
            List<String> features = new ArrayList<>(List.of("ACID", "Foreign Keys", "Triggers", "Stored Procedures", "Views"));
            if (version != null && version.contains("MariaDB")) {
                features.add("MariaDB Extensions");
            }
            return DatabaseCapabilities.builder()
                    .version(version == null ? "Unknown" : version)
                    .supportsTransactions(true)
                    .supportsStoredProcedures(true)
                    .supportsViews(true)
                    .supportsMaterializedViews(false)
                    .supportsJson(true)
                    .supportsFullTextSearch(true)
                    .maxConnections(PostgresConnector.parseInt(maxConnections))
                    .features(features)
                    .build();
        } catch (SQLException e) {
            throw translate("detectCapabilities", e);
        }
    }
}
