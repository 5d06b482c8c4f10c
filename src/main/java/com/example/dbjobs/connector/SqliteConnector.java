package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.enums.DatabaseType;

import java.sql.SQLException;
import java.util.List;

/**
 * 单文件库，只有一个 "main" schema
 */
public class SqliteConnector extends AbstractJdbcConnector {

    public SqliteConnector(ConnectionTarget target) {
        super(target);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    protected String schemaPatternOf(String schema) {
        return null;
    }

    @Override
    public List<String> listDatabases() {
        return List.of("main");
    }

    @Override
    public List<String> listSchemas() {
        return List.of("main");
    }

    @Override
    public DatabaseCapabilities detectCapabilities() {
        try {
            String version = queryForString("SELECT sqlite_version()");
            return DatabaseCapabilities.builder()
                    .version("SQLite " + version)
                    .supportsTransactions(true)
                    .supportsStoredProcedures(false)
                    .supportsViews(true)
                    .supportsMaterializedViews(false)
                    .supportsJson(true)
                    .supportsFullTextSearch(true)
                    .maxConnections(1)
                    .features(List.of("ACID", "Triggers", "Views", "JSON", "Full Text Search (FTS5)"))
                    .build();
        } catch (SQLException e) {
            throw translate("detectCapabilities", e);
        }
    }
}
