package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ProcedureInfo;
import com.example.dbjobs.dto.ProcedureParameter;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.util.ConfigValues;
import com.example.dbjobs.util.JdbcRows;
import com.example.dbjobs.util.SqlTypes;
import org.apache.commons.lang3.StringUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 调用存储过程 / 函数
 * <p>
 * 配置: procedure_name (必填), schema, parameters ([{name, type, value}]), is_function
 * 函数用 SELECT schema.fn(?, ...)，过程用 {call schema.proc(?, ...)}
 */
public class ProcedureExecutor extends AbstractJobExecutor {
    public static final String PROCEDURE_NAME = "procedure_name";
    public static final String SCHEMA = "schema";
    public static final String PARAMETERS = "parameters";
    public static final String IS_FUNCTION = "is_function";

    static final int PREVIEW_ROWS = 100;

    // 名字会拼进 SQL，只允许普通标识符
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private static final String ROUTINES_SQL =
            "SELECT routine_name, routine_type, data_type, routine_definition " +
            "FROM information_schema.routines WHERE routine_schema = ? ORDER BY routine_name";

    private static final String PARAMETERS_SQL =
            "SELECT p.parameter_name, p.data_type, p.parameter_mode, p.ordinal_position " +
            "FROM information_schema.parameters p " +
            "JOIN information_schema.routines r " +
            "ON p.specific_schema = r.specific_schema AND p.specific_name = r.specific_name " +
            "WHERE r.routine_schema = ? AND r.routine_name = ? AND p.ordinal_position > 0 " +
            "ORDER BY p.ordinal_position";

    private final ConnectionOpener connectionOpener;

    public ProcedureExecutor(ExecutionContext context, ConnectionOpener connectionOpener) {
        super(context);
        this.connectionOpener = connectionOpener;
    }

    @Override
    public JobType getJobType() {
        return JobType.STORED_PROCEDURE;
    }

    @Override
    public ValidationResult validateConfig() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (context.getTarget() != null && context.getTarget().isDocumentStore()) {
            errors.add("Stored procedure jobs require a relational database connection");
        }

        String name = ConfigValues.getString(config, PROCEDURE_NAME);
        if (StringUtils.isBlank(name)) {
            errors.add("Missing required field: procedure_name");
        } else if (!IDENTIFIER.matcher(name).matches()) {
            errors.add("Invalid procedure name: " + name);
        }

        String schema = ConfigValues.getString(config, SCHEMA);
        if (schema == null) {
            warnings.add("Schema not specified, using default schema");
        } else if (!IDENTIFIER.matcher(schema).matches()) {
            errors.add("Invalid schema name: " + schema);
        }

        Object parameters = config.get(PARAMETERS);
        if (parameters != null && !(parameters instanceof List)) {
            errors.add("Parameters must be a list");
        } else if (parameters != null) {
            int position = 0;
            for (Object item : (List<?>) parameters) {
                position++;
                if (!(item instanceof Map)) {
                    errors.add("Parameter " + position + " must be an object with a value");
                    continue;
                }
                Map<?, ?> param = (Map<?, ?>) item;
                Object type = param.get("type");
                Object value = param.get("value");
                if (type != null && SqlTypes.isMismatch(type.toString(), value)) {
                    Object label = param.get("name") != null ? param.get("name") : position;
                    warnings.add("Parameter '" + label + "' value does not match declared type " + type);
                }
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    private String resolveSchema() {
        return StringUtils.firstNonBlank(ConfigValues.getString(config, SCHEMA), context.getTargetSchema());
    }

    String buildCall(int paramCount, boolean isFunction) {
        String schema = resolveSchema();
        String qualified = (schema == null ? "" : schema + ".") + ConfigValues.getString(config, PROCEDURE_NAME);
        String placeholders = String.join(", ", Collections.nCopies(paramCount, "?"));
        return isFunction
                ? "SELECT " + qualified + "(" + placeholders + ")"
                : "{call " + qualified + "(" + placeholders + ")}";
    }

    @SuppressWarnings("unchecked")
    private List<Object> parameterValues() {
        Object parameters = config.get(PARAMETERS);
        List<Object> values = new ArrayList<>();
        if (parameters instanceof List) {
            for (Object item : (List<Object>) parameters) {
                values.add(((Map<String, Object>) item).get("value"));
            }
        }
        return values;
    }

    @Override
    protected ExecutionResult doExecute(Long executionId) {
        List<Object> values = parameterValues();
        boolean isFunction = ConfigValues.getBoolean(config, IS_FUNCTION, false);
        String sql = buildCall(values.size(), isFunction);

        logInfo("Procedure: {}", sql);
        logInfo("Parameters: {}", sanitize(config.get(PARAMETERS)));

        Connection conn = null;
        try {
            conn = connectionOpener.open(context.getTarget());
            logInfo("Database connection established");
            checkCancelled(executionId);

            try (PreparedStatement stmt = isFunction ? conn.prepareStatement(sql) : conn.prepareCall(sql)) {
                onCancel(executionId, () -> cancelStatement(stmt));
                if (context.getMaxRuntimeSeconds() > 0) {
                    stmt.setQueryTimeout(context.getMaxRuntimeSeconds());
                }
                for (int i = 0; i < values.size(); i++) {
                    stmt.setObject(i + 1, values.get(i));
                }
                boolean hasResultSet = stmt.execute();
                countStatement();
                logInfo("Procedure executed successfully");

                Map<String, Object> resultData = new LinkedHashMap<>();
                long rowsProcessed = 0;
                if (hasResultSet) {
                    try (ResultSet rs = stmt.getResultSet()) {
                        List<String> columns = JdbcRows.columnLabels(rs.getMetaData());
                        JdbcRows.Page page = JdbcRows.read(rs, columns, PREVIEW_ROWS);
                        rowsProcessed = page.getTotalRows();
                        if (rowsProcessed > 0) {
                            resultData.put("columns", columns);
                            resultData.put("rows", page.getRows());
                            resultData.put("total_rows", page.getTotalRows());
                            logInfo("Procedure returned {} rows", rowsProcessed);
                        } else {
                            resultData.put("message", "Procedure executed successfully, no rows returned");
                        }
                    }
                } else {
                    resultData.put("message", "Procedure executed successfully");
                }
                checkCancelled(executionId);
                return ExecutionResult.builder()
                        .success(true)
                        .rowsProcessed(rowsProcessed)
                        .resultData(resultData)
                        .build();
            }
        } catch (SQLException e) {
            return sqlFailure(executionId, "Procedure execution", e);
        } finally {
            closeQuietly(conn);
        }
    }

    private void cancelStatement(PreparedStatement stmt) {
        try {
            stmt.cancel();
        } catch (SQLException e) {
            logWarn("Statement cancel failed: {}", e.getMessage());
        }
    }

    @Override
    public List<String> getRequiredPermissions() {
        return List.of("EXECUTE");
    }

    /**
     * 列出 schema 下的函数和存储过程
     */
    public static List<ProcedureInfo> discoverProcedures(ConnectionOpener opener, ConnectionTarget target,
                                                         String schema) throws SQLException {
        List<ProcedureInfo> procedures = new ArrayList<>();
        try (Connection conn = opener.open(target);
             PreparedStatement ps = conn.prepareStatement(ROUTINES_SQL)) {
            ps.setString(1, schema);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    procedures.add(new ProcedureInfo(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)));
                }
            }
        }
        return procedures;
    }

    public static List<ProcedureParameter> getProcedureParameters(ConnectionOpener opener, ConnectionTarget target,
                                                                  String procedureName, String schema) throws SQLException {
        List<ProcedureParameter> parameters = new ArrayList<>();
        try (Connection conn = opener.open(target);
             PreparedStatement ps = conn.prepareStatement(PARAMETERS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, procedureName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    parameters.add(new ProcedureParameter(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4)));
                }
            }
        }
        return parameters;
    }
}
