package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.service.ExecutionControlManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProcedureExecutorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-04-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock private ConnectionOpener opener;
    @Mock private Connection conn;
    @Mock private CallableStatement call;
    @Mock private ResultSet rs;
    @Mock private ResultSetMetaData meta;

    private final ConnectionTarget target = ConnectionTarget.builder()
            .dbType(DatabaseType.POSTGRESQL)
            .url("jdbc:postgresql://pg.local:5432/erp")
            .build();

    private ProcedureExecutor executor(Map<String, Object> config, String targetSchema) {
        return new ProcedureExecutor(ExecutionContext.builder()
                .target(target)
                .config(config)
                .targetSchema(targetSchema)
                .control(new ExecutionControlManager())
                .clock(CLOCK)
                .build(), opener);
    }

    private static Map<String, Object> param(String name, String type, Object value) {
        Map<String, Object> param = new HashMap<>();
        param.put("name", name);
        param.put("type", type);
        param.put("value", value);
        return param;
    }

    @Test
    @DisplayName("过程与函数的调用语句")
    void buildCall() {
        Map<String, Object> config = Map.of("procedure_name", "refresh_stats", "schema", "reporting");
        assertEquals("{call reporting.refresh_stats(?, ?)}", executor(config, null).buildCall(2, false));
        assertEquals("SELECT reporting.refresh_stats()", executor(config, null).buildCall(0, true));
    }

    @Test
    @DisplayName("未配置 schema 时用作业的目标 schema，都没有就不加前缀")
    void schemaFallback() {
        Map<String, Object> config = Map.of("procedure_name", "refresh_stats");
        assertEquals("{call ops.refresh_stats(?)}", executor(config, "ops").buildCall(1, false));
        assertEquals("{call refresh_stats()}", executor(config, null).buildCall(0, false));
    }

    @Test
    @DisplayName("校验: 缺过程名、非法标识符、参数不是列表")
    void validationErrors() {
        assertEquals(List.of("Missing required field: procedure_name"),
                executor(Map.of("schema", "s"), null).validateConfig().getErrors());

        ValidationResult injected = executor(Map.of("procedure_name", "p; DROP TABLE x", "schema", "s"), null).validateConfig();
        assertFalse(injected.isValid());
        assertTrue(injected.getErrors().get(0).startsWith("Invalid procedure name"));

        ValidationResult badParams = executor(Map.of("procedure_name", "p", "schema", "s", "parameters", "1,2"), null).validateConfig();
        assertEquals(List.of("Parameters must be a list"), badParams.getErrors());
    }

    @Test
    @DisplayName("校验警告: 未指定 schema、参数值与类型不符")
    void validationWarnings() {
        Map<String, Object> config = new HashMap<>();
        config.put("procedure_name", "archive_orders");
        config.put("parameters", List.of(param("days", "integer", "abc"), param("dry_run", "boolean", true)));

        ValidationResult result = executor(config, null).validateConfig();

        assertTrue(result.isValid());
        assertEquals(List.of(
                "Schema not specified, using default schema",
                "Parameter 'days' value does not match declared type integer"), result.getWarnings());
    }

    @Test
    @DisplayName("调用成功: 绑定参数并返回结果集预览")
    void executeSuccess() throws Exception {
        Map<String, Object> config = new HashMap<>();
        config.put("procedure_name", "archive_orders");
        config.put("schema", "ops");
        config.put("parameters", List.of(param("days", "integer", 30)));

        when(opener.open(target)).thenReturn(conn);
        when(conn.prepareCall("{call ops.archive_orders(?)}")).thenReturn(call);
        when(call.execute()).thenReturn(true);
        when(call.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("archived");
        when(meta.getColumnType(1)).thenReturn(Types.INTEGER);
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(42);

        ExecutionResult result = executor(config, null).execute(7L);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals(1, result.getRowsProcessed());
        assertEquals(List.of("archived"), result.getResultData().get("columns"));
        assertEquals(List.of(Map.of("archived", 42)), result.getResultData().get("rows"));
        assertTrue(result.getExecutionLog().contains("Procedure: {call ops.archive_orders(?)}"));
        verify(call).setObject(1, 30);
        verify(conn).close();
    }

    @Test
    @DisplayName("没有结果集时只返回提示信息")
    void executeWithoutResultSet() throws Exception {
        when(opener.open(target)).thenReturn(conn);
        when(conn.prepareCall("{call ops.vacuum_logs()}")).thenReturn(call);
        when(call.execute()).thenReturn(false);

        ExecutionResult result = executor(Map.of("procedure_name", "vacuum_logs", "schema", "ops"), null).execute(8L);

        assertTrue(result.isSuccess());
        assertEquals(Map.of("message", "Procedure executed successfully"), result.getResultData());
    }

    @Test
    @DisplayName("数据库报错: 失败结果带错误信息和堆栈，连接被关闭")
    void executeFailure() throws Exception {
        when(opener.open(target)).thenReturn(conn);
        when(conn.prepareCall("{call ops.archive_orders()}")).thenReturn(call);
        when(call.execute()).thenThrow(new SQLException("function ops.archive_orders() does not exist"));

        ExecutionResult result = executor(Map.of("procedure_name", "archive_orders", "schema", "ops"), null).execute(9L);

        assertFalse(result.isSuccess());
        assertEquals("function ops.archive_orders() does not exist", result.getErrorMessage());
        assertTrue(result.getErrorTrace().contains("SQLException"));
        verify(conn).close();
    }

    @Test
    @DisplayName("所需权限: EXECUTE")
    void permissions() {
        assertEquals(List.of("EXECUTE"), executor(Map.of(), null).getRequiredPermissions());
    }
}
