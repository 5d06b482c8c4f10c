package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ColumnInfo;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.QueryResult;
import com.example.dbjobs.dto.TableInfo;
import com.example.dbjobs.dto.TableSchema;
import com.example.dbjobs.exception.ConnectionException;
import com.example.dbjobs.util.JdbcRows;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterUtils;
import org.springframework.jdbc.core.namedparam.ParsedSql;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 关系库连接器的公共实现：HikariCP 连接池 + 一个会话连接(查询/事务用)
 * 表结构内省统一走 {@link DatabaseMetaData}
 */
@Slf4j
public abstract class AbstractJdbcConnector implements Connector {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    protected final ConnectionTarget target;

    // connect/disconnect 持有 this 锁；isConnected 只读这两个字段，不加锁
    private volatile HikariDataSource dataSource;
    private volatile Connection session;
    // 查询、事务都在会话连接上，同一时刻只有一个线程在用；加锁顺序 sessionLock -> this
    private final Object sessionLock = new Object();

    protected AbstractJdbcConnector(ConnectionTarget target) {
        this.target = target;
    }

    /**
     * 各库补充驱动参数 (SSL 等)
     */
    protected void customize(HikariConfig config) {
    }

    protected String validationQuery() {
        return "SELECT 1";
    }

    @Override
    public synchronized void connect() {
        if (isConnected()) {
            return;
        }
        disconnect();
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(target.getUrl());
        config.setUsername(target.getUsername());
        config.setPassword(target.getPassword());
        config.setPoolName("Connector-" + getDatabaseType() + "-" + POOL_SEQ.incrementAndGet());
        // 会话连接常驻占一个，另加 poolSize 个给探活等借用
        config.setMaximumPoolSize(Math.max(1, target.getPoolSize()) + 1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(Math.max(1, target.getTimeoutSeconds()) * 1000L);
        config.setReadOnly(target.isReadOnly());
        customize(config);
        try {
            dataSource = new HikariDataSource(config);
            session = dataSource.getConnection();
        } catch (SQLException | RuntimeException e) {
            // HikariDataSource 初始化失败抛的是 PoolInitializationException (RuntimeException)
            disconnect();
            throw new ConnectionException("Failed to connect to " + getDatabaseType() + ": " + e.getMessage(), e);
        }
        log.info("连接器已建立: {} {}", getDatabaseType(), target.getHost());
    }

    @Override
    public synchronized void disconnect() {
        if (session != null) {
            try {
                session.close();
            } catch (SQLException e) {
                log.warn("关闭会话连接失败: {}", e.getMessage());
            }
            session = null;
        }
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
    }

    @Override
    public boolean isConnected() {
        HikariDataSource ds = dataSource;
        Connection conn = session;
        if (conn == null || ds == null || ds.isClosed()) {
            return false;
        }
        try {
            return !conn.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public HealthCheckResult testConnection() {
        long start = System.currentTimeMillis();
        try {
            HikariDataSource ds = ensureDataSource();
            // 探活从池里借一个连接，不占用会话连接，避免和正在跑的查询互相阻塞
            try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(Math.max(1, target.getTimeoutSeconds()));
                stmt.execute(validationQuery());
            }
            return HealthCheckResult.healthy(System.currentTimeMillis() - start);
        } catch (Exception e) {
            return HealthCheckResult.unhealthy(System.currentTimeMillis() - start, e.getMessage());
        }
    }

    private HikariDataSource ensureDataSource() {
        HikariDataSource ds = dataSource;
        if (ds != null && !ds.isClosed()) {
            return ds;
        }
        synchronized (this) {
            if (!isConnected()) {
                connect();
            }
            return dataSource;
        }
    }

    /**
     * 调用方必须持有 sessionLock
     */
    private Connection session() {
        Connection conn = session;
        if (conn != null && isConnected()) {
            return conn;
        }
        synchronized (this) {
            if (!isConnected()) {
                connect();
            }
            return session;
        }
    }

    @Override
    public QueryResult executeQuery(String sql, Map<String, Object> params) {
        synchronized (sessionLock) {
            long start = System.currentTimeMillis();
            try {
                Connection conn = session();
                ParsedSql parsed = NamedParameterUtils.parseSqlStatement(sql);
                MapSqlParameterSource source = new MapSqlParameterSource(params == null ? Collections.emptyMap() : params);
                String jdbcSql = NamedParameterUtils.substituteNamedParameters(parsed, source);
                Object[] args = NamedParameterUtils.buildValueArray(parsed, source, null);

                try (PreparedStatement ps = conn.prepareStatement(jdbcSql)) {
                    ps.setQueryTimeout(Math.max(0, target.getTimeoutSeconds()));
                    for (int i = 0; i < args.length; i++) {
                        ps.setObject(i + 1, args[i]);
                    }
                    if (ps.execute()) {
                        try (ResultSet rs = ps.getResultSet()) {
                            List<String> columns = JdbcRows.columnLabels(rs.getMetaData());
                            List<Map<String, Object>> rows = JdbcRows.readAll(rs, columns);
                            return QueryResult.success(rows, columns, System.currentTimeMillis() - start);
                        }
                    }
                    List<Map<String, Object>> affected = new ArrayList<>();
                    affected.add(Collections.singletonMap("rows_affected", ps.getUpdateCount()));
                    return QueryResult.success(affected, List.of("rows_affected"), System.currentTimeMillis() - start);
                }
            } catch (SQLTimeoutException e) {
                return QueryResult.timeout(e.getMessage(), System.currentTimeMillis() - start);
            } catch (SQLException | ConnectionException e) {
                return QueryResult.error(e.getMessage(), System.currentTimeMillis() - start);
            } catch (DataAccessException e) {
                // 命名参数缺值等，NamedParameterUtils 抛的是 InvalidDataAccessApiUsageException
                return QueryResult.error(e.getMessage(), System.currentTimeMillis() - start);
            }
        }
    }

    @Override
    public boolean executeDDL(String sql) {
        synchronized (sessionLock) {
            Connection conn = session();
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
                if (!conn.getAutoCommit()) {
                    conn.commit();
                }
                return true;
            } catch (SQLException e) {
                log.error("failed to execute DDL: {}", e.getMessage());
                safeRollback(conn);
                return false;
            }
        }
    }

    private void safeRollback(Connection conn) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            log.warn("回滚失败: {}", e.getMessage());
        }
    }

    @Override
    public List<String> listDatabases() {
        synchronized (sessionLock) {
            try (ResultSet rs = session().getMetaData().getCatalogs()) {
                List<String> names = new ArrayList<>();
                while (rs.next()) {
                    names.add(rs.getString("TABLE_CAT"));
                }
                return names;
            } catch (SQLException e) {
                throw translate("listDatabases", e);
            }
        }
    }

    @Override
    public List<String> listSchemas() {
        synchronized (sessionLock) {
            try (ResultSet rs = session().getMetaData().getSchemas()) {
                List<String> names = new ArrayList<>();
                while (rs.next()) {
                    names.add(rs.getString("TABLE_SCHEM"));
                }
                return names;
            } catch (SQLException e) {
                throw translate("listSchemas", e);
            }
        }
    }

    /**
     * MySQL 的 "schema" 对应 JDBC 的 catalog，子类覆盖
     */
    protected String catalogOf(String schema) {
        return null;
    }

    protected String schemaPatternOf(String schema) {
        return schema;
    }

    @Override
    public List<TableInfo> listTables(String schema) {
        synchronized (sessionLock) {
            try {
                DatabaseMetaData meta = session().getMetaData();
                List<TableInfo> tables = new ArrayList<>();
                String[] types = {"TABLE", "VIEW", "MATERIALIZED VIEW"};
                try (ResultSet rs = meta.getTables(catalogOf(schema), schemaPatternOf(schema), "%", types)) {
                    while (rs.next()) {
                        String type = rs.getString("TABLE_TYPE");
                        tables.add(new TableInfo(rs.getString("TABLE_NAME"), schema, normalizeTableType(type)));
                    }
                }
                return tables;
            } catch (SQLException e) {
                throw translate("listTables", e);
            }
        }
    }

    private static String normalizeTableType(String jdbcType) {
        if (jdbcType == null) {
            return "table";
        }
        return jdbcType.toLowerCase().replace(' ', '_');
    }

    @Override
    public TableSchema getTableSchema(String table, String schema) {
        synchronized (sessionLock) {
            try {
                DatabaseMetaData meta = session().getMetaData();
                String catalog = catalogOf(schema);
                String schemaPattern = schemaPatternOf(schema);

                List<String> primaryKeys = new ArrayList<>();
                try (ResultSet rs = meta.getPrimaryKeys(catalog, schemaPattern, table)) {
                    while (rs.next()) {
                        primaryKeys.add(rs.getString("COLUMN_NAME"));
                    }
                }

                List<Map<String, Object>> foreignKeys = new ArrayList<>();
                Set<String> fkColumns = new LinkedHashSet<>();
                try (ResultSet rs = meta.getImportedKeys(catalog, schemaPattern, table)) {
                    while (rs.next()) {
                        Map<String, Object> fk = new LinkedHashMap<>();
                        fk.put("name", rs.getString("FK_NAME"));
                        fk.put("column", rs.getString("FKCOLUMN_NAME"));
                        fk.put("referred_schema", rs.getString("PKTABLE_SCHEM"));
                        fk.put("referred_table", rs.getString("PKTABLE_NAME"));
                        fk.put("referred_column", rs.getString("PKCOLUMN_NAME"));
                        foreignKeys.add(fk);
                        fkColumns.add(rs.getString("FKCOLUMN_NAME"));
                    }
                }

                List<ColumnInfo> columns = new ArrayList<>();
                try (ResultSet rs = meta.getColumns(catalog, schemaPattern, table, "%")) {
                    while (rs.next()) {
                        String name = rs.getString("COLUMN_NAME");
                        columns.add(new ColumnInfo(
                                name,
                                rs.getString("TYPE_NAME"),
                                rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                                rs.getString("COLUMN_DEF"),
                                primaryKeys.contains(name),
                                fkColumns.contains(name)));
                    }
                }

                // 同一个索引多列时会返回多行，按索引名合并
                Map<String, Map<String, Object>> indexByName = new LinkedHashMap<>();
                try (ResultSet rs = meta.getIndexInfo(catalog, schemaPattern, table, false, true)) {
                    while (rs.next()) {
                        String indexName = rs.getString("INDEX_NAME");
                        if (indexName == null) {
                            continue;
                        }
                        boolean unique = !rs.getBoolean("NON_UNIQUE");
                        String column = rs.getString("COLUMN_NAME");
                        Map<String, Object> index = indexByName.computeIfAbsent(indexName, k -> {
                            Map<String, Object> m = new LinkedHashMap<>();
                            m.put("name", k);
                            m.put("unique", unique);
                            m.put("columns", new ArrayList<String>());
                            return m;
                        });
                        @SuppressWarnings("unchecked")
                        List<String> indexColumns = (List<String>) index.get("columns");
                        indexColumns.add(column);
                    }
                }

                return new TableSchema(table, schema, columns, primaryKeys, foreignKeys, new ArrayList<>(indexByName.values()));
            } catch (SQLException e) {
                throw translate("getTableSchema", e);
            }
        }
    }

    @Override
    public void startTransaction() {
        synchronized (sessionLock) {
            try {
                session().setAutoCommit(false);
            } catch (SQLException e) {
                throw translate("startTransaction", e);
            }
        }
    }

    @Override
    public void commit() {
        synchronized (sessionLock) {
            try {
                Connection conn = session();
                conn.commit();
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                throw translate("commit", e);
            }
        }
    }

    @Override
    public void rollback() {
        synchronized (sessionLock) {
            try {
                Connection conn = session();
                conn.rollback();
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                throw translate("rollback", e);
            }
        }
    }

    /**
     * SQLState 08xxx 是连接类错误，其它按程序错误处理
     */
    protected RuntimeException translate(String operation, SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            return new ConnectionException(operation + " failed: " + e.getMessage(), e);
        }
        return new IllegalStateException(operation + " failed: " + e.getMessage(), e);
    }

    /**
     * 执行返回单个值的查询 (版本号等)
     */
    protected String queryForString(String sql) throws SQLException {
        synchronized (sessionLock) {
            try (Statement stmt = session().createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    protected List<String> queryForList(String sql) throws SQLException {
        synchronized (sessionLock) {
            List<String> values = new ArrayList<>();
            try (Statement stmt = session().createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
            return values;
        }
    }
}
