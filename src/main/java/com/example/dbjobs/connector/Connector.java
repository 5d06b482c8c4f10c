package com.example.dbjobs.connector;

import com.example.dbjobs.dto.DatabaseCapabilities;
import com.example.dbjobs.dto.HealthCheckResult;
import com.example.dbjobs.dto.QueryResult;
import com.example.dbjobs.dto.TableInfo;
import com.example.dbjobs.dto.TableSchema;
import com.example.dbjobs.enums.DatabaseType;

import java.util.List;
import java.util.Map;

/**
 * 各类数据库统一的访问接口
 * <p>
 * 约定：
 * <ul>
 *     <li>connect / disconnect 幂等，disconnect 后资源必须全部释放</li>
 *     <li>testConnection / executeQuery 对预期内的失败返回结果对象，不抛异常</li>
 *     <li>引擎本身不支持的操作(如文档库的 DDL)抛 {@link UnsupportedOperationException}</li>
 * </ul>
 */
public interface Connector extends AutoCloseable {

    DatabaseType getDatabaseType();

    /**
     * @throws com.example.dbjobs.exception.ConnectionException 连接失败
     */
    void connect();

    void disconnect();

    boolean isConnected();

    HealthCheckResult testConnection();

    QueryResult executeQuery(String query, Map<String, Object> params);

    boolean executeDDL(String sql);

    List<String> listDatabases();

    List<String> listSchemas();

    List<TableInfo> listTables(String schema);

    TableSchema getTableSchema(String table, String schema);

    void startTransaction();

    void commit();

    void rollback();

    DatabaseCapabilities detectCapabilities();

    @Override
    default void close() {
        disconnect();
    }
}
