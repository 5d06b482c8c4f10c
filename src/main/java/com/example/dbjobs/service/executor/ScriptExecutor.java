package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.util.ConfigValues;
import com.example.dbjobs.util.JdbcRows;
import org.apache.commons.lang3.StringUtils;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 执行 SQL 脚本
 * <p>
 * 配置: sql_script (必填), read_only (默认 false), use_transaction (默认 true)
 * 整个脚本一次交给驱动执行，由数据库自己拆分语句 ($$ 函数体、引号里的分号都不用管)，
 * 依次遍历各语句的更新数和结果集，返回最后一个结果集的前 100 行。
 * MySQL 需要 allowMultiQueries (见 {@link DriverManagerConnectionOpener})；
 * SQLite 驱动一次只编译第一条语句。
 */
public class ScriptExecutor extends AbstractJobExecutor {
    public static final String SQL_SCRIPT = "sql_script";
    public static final String READ_ONLY = "read_only";
    public static final String USE_TRANSACTION = "use_transaction";

    static final int PREVIEW_ROWS = 100;

    private static final List<String> WRITE_KEYWORDS = List.of("INSERT", "UPDATE", "DELETE", "CREATE", "ALTER", "DROP", "TRUNCATE");
    private static final List<String> DANGEROUS_OPERATIONS = List.of("DROP DATABASE", "DROP SCHEMA", "TRUNCATE TABLE");

    private final ConnectionOpener connectionOpener;

    public ScriptExecutor(ExecutionContext context, ConnectionOpener connectionOpener) {
        super(context);
        this.connectionOpener = connectionOpener;
    }

    @Override
    public JobType getJobType() {
        return JobType.SQL_SCRIPT;
    }

    @Override
    public ValidationResult validateConfig() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (context.getTarget() != null && context.getTarget().isDocumentStore()) {
            errors.add("SQL script jobs require a relational database connection");
        }

        String script = ConfigValues.getString(config, SQL_SCRIPT);
        if (script == null) {
            errors.add("Missing required field: sql_script");
        } else if (script.isBlank()) {
            errors.add("SQL script cannot be empty");
        }

        if (context.getTarget() != null && context.getTarget().getDbType() == DatabaseType.SQLITE
                && hasTrailingStatements(script)) {
            warnings.add("SQLite executes only the first statement of a script, later statements are ignored");
        }

        String upper = StringUtils.defaultString(script).toUpperCase(Locale.ROOT);
        for (String op : DANGEROUS_OPERATIONS) {
            if (containsPhrase(upper, op)) {
                warnings.add("Potentially dangerous operation detected: " + op);
            }
        }

        if (ConfigValues.getBoolean(config, READ_ONLY, false)) {
            for (String keyword : WRITE_KEYWORDS) {
                if (containsWord(upper, keyword)) {
                    errors.add("Write operation '" + keyword + "' not allowed in read-only mode");
                }
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    /**
     * 去掉末尾分号后仍含 ";" 视为多语句，引号里的分号也算，只用于警告
     */
    static boolean hasTrailingStatements(String script) {
        String body = StringUtils.stripEnd(StringUtils.defaultString(script).trim(), ";").trim();
        return body.contains(";");
    }

    static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + word + "\\b").matcher(text).find();
    }

    private static boolean containsPhrase(String text, String phrase) {
        return Pattern.compile("\\b" + phrase.replace(" ", "\\s+") + "\\b").matcher(text).find();
    }

    @Override
    protected ExecutionResult doExecute(Long executionId) {
        String script = ConfigValues.getString(config, SQL_SCRIPT);
        boolean readOnly = ConfigValues.getBoolean(config, READ_ONLY, false);
        boolean useTransaction = ConfigValues.getBoolean(config, USE_TRANSACTION, true);

        logInfo("SQL script length: {} characters", script.length());
        logInfo("Read-only mode: {}", readOnly);
        logInfo("Transaction mode: {}", useTransaction);

        Connection conn = null;
        try {
            conn = connectionOpener.open(context.getTarget());
            logInfo("Database connection established");
            if (readOnly) {
                applyReadOnly(conn);
            }
            if (useTransaction) {
                conn.setAutoCommit(false);
                logInfo("Transaction started");
            }

            long rowsAffected = 0;
            long rowsProcessed = 0;
            Map<String, Object> lastResult = null;
            checkCancelled(executionId);
            try (Statement stmt = conn.createStatement()) {
                onCancel(executionId, () -> cancelStatement(stmt));
                if (context.getMaxRuntimeSeconds() > 0) {
                    stmt.setQueryTimeout(context.getMaxRuntimeSeconds());
                }
                boolean hasResultSet = stmt.execute(script);
                int index = 0;
                while (true) {
                    if (hasResultSet) {
                        index++;
                        countStatement();
                        try (ResultSet rs = stmt.getResultSet()) {
                            List<String> columns = JdbcRows.columnLabels(rs.getMetaData());
                            JdbcRows.Page page = JdbcRows.read(rs, columns, PREVIEW_ROWS);
                            rowsProcessed += page.getTotalRows();
                            lastResult = new LinkedHashMap<>();
                            lastResult.put("columns", columns);
                            lastResult.put("rows", page.getRows());
                            lastResult.put("total_rows", page.getTotalRows());
                            logInfo("Statement {} returned {} rows", index, page.getTotalRows());
                        }
                    } else {
                        int count = stmt.getUpdateCount();
                        if (count == -1) {
                            break;
                        }
                        index++;
                        countStatement();
                        if (count > 0) {
                            rowsAffected += count;
                        }
                    }
                    checkCancelled(executionId);
                    hasResultSet = stmt.getMoreResults();
                }
                logInfo("Script produced {} statement result(s)", index);
            }
            checkCancelled(executionId);

            if (useTransaction) {
                conn.commit();
                logInfo("Transaction committed");
            }
            logInfo("Script executed successfully, rows affected: {}", rowsAffected);
            return ExecutionResult.builder()
                    .success(true)
                    .rowsAffected(rowsAffected)
                    .rowsProcessed(rowsProcessed)
                    .resultData(lastResult)
                    .build();
        } catch (SQLException e) {
            if (conn != null) {
                rollbackQuietly(conn);
            }
            return sqlFailure(executionId, "SQL execution", e);
        } catch (RuntimeException e) {
            // 包括取消，回滚后继续往上抛
            if (conn != null) {
                rollbackQuietly(conn);
            }
            throw e;
        } finally {
            closeQuietly(conn);
        }
    }

    /**
     * 部分驱动 (SQLite) 不允许连接建立后再切只读，此时只靠上面的关键字校验
     */
    private void applyReadOnly(Connection conn) {
        try {
            conn.setReadOnly(true);
        } catch (SQLException e) {
            logWarn("Driver rejected read-only flag: {}", e.getMessage());
        }
    }

    private void cancelStatement(Statement stmt) {
        try {
            stmt.cancel();
        } catch (SQLException e) {
            logWarn("Statement cancel failed: {}", e.getMessage());
        }
    }

    @Override
    public List<String> getRequiredPermissions() {
        String upper = StringUtils.defaultString(ConfigValues.getString(config, SQL_SCRIPT)).toUpperCase(Locale.ROOT);
        Set<String> permissions = new LinkedHashSet<>();
        if (containsWord(upper, "SELECT") || containsWord(upper, "WITH")) {
            permissions.add("SELECT");
        }
        for (String dml : List.of("INSERT", "UPDATE", "DELETE")) {
            if (containsWord(upper, dml)) {
                permissions.add(dml);
            }
        }
        if (containsWord(upper, "CREATE") || containsWord(upper, "ALTER") || containsWord(upper, "DROP")) {
            permissions.add("DDL");
        }
        return new ArrayList<>(permissions);
    }
}
