package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.enums.DatabaseType;
import com.zaxxer.hikari.HikariConfig;
import org.apache.commons.lang3.StringUtils;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

public class PostgresConnector extends AbstractJdbcConnector {

    public PostgresConnector(ConnectionTarget target) {
        super(target);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    protected void customize(HikariConfig config) {
        if (!target.isSslEnabled()) {
            return;
        }
        config.addDataSourceProperty("ssl", "true");
        config.addDataSourceProperty("sslmode", StringUtils.isNotBlank(target.getSslCaPath()) ? "verify-full" : "require");
        if (StringUtils.isNotBlank(target.getSslCaPath())) {
            config.addDataSourceProperty("sslrootcert", target.getSslCaPath());
        }
        if (StringUtils.isNotBlank(target.getSslCertPath())) {
            config.addDataSourceProperty("sslcert", target.getSslCertPath());
        }
        if (StringUtils.isNotBlank(target.getSslKeyPath())) {
            config.addDataSourceProperty("sslkey", target.getSslKeyPath());
        }
    }

    @Override
    public List<String> listDatabases() {
        try {
            return queryForList("SELECT datname FROM pg_database WHERE datistemplate = false ORDER BY datname");
        } catch (SQLException e) {
            throw translate("listDatabases", e);
        }
    }

    @Override
    public List<String> listSchemas() {
        return super.listSchemas().stream()
                .filter(s -> !s.startsWith("pg_") && !"information_schema".equals(s))
                .collect(Collectors.toList());
    }

    @Override
    public DatabaseCapabilities detectCapabilities() {
        try {
            String version = queryForString("SELECT version()");
            List<String> extensions = queryForList("SELECT extname FROM pg_extension");
            String maxConnections = queryForString("SHOW max_connections");
            return DatabaseCapabilities.builder()
                    .version(version == null ? "Unknown" : version)
                    .supportsTransactions(true)
                    .supportsStoredProcedures(true)
                    .supportsViews(true)
                    .supportsMaterializedViews(true)
                    .supportsJson(true)
                    .supportsFullTextSearch(true)
                    .maxConnections(parseInt(maxConnections))
                    .features(List.of("ACID", "Foreign Keys", "Triggers", "Stored Procedures", "JSON", "Full Text Search"))
                    .extensions(extensions)
                    .build();
        } catch (SQLException e) {
            throw translate("detectCapabilities", e);
        }
    }

    static int parseInt(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
