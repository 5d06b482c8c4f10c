package com.example.dbjobs.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ResultSet 读取工具，值转换成可直接 JSON 序列化的形式
 */
public final class JdbcRows {

    private JdbcRows() {
    }

    public static List<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        List<String> columns = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i));
        }
        return columns;
    }

    public static List<Map<String, Object>> readAll(ResultSet rs, List<String> columns) throws SQLException {
        return read(rs, columns, Integer.MAX_VALUE).getRows();
    }

    /**
     * 最多保留 limit 行，但继续走完结果集统计真实总行数
     */
    public static Page read(ResultSet rs, List<String> columns, int limit) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        long total = 0;
        while (rs.next()) {
            total++;
            if (rows.size() < limit) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns.size(); i++) {
                    row.put(columns.get(i - 1), readValue(rs, i, meta.getColumnType(i)));
                }
                rows.add(row);
            }
        }
        return new Page(rows, total);
    }

    static Object readValue(ResultSet rs, int index, int sqlType) throws SQLException {
        if (SqlTypes.isBlobType(sqlType)) {
            Object raw = rs.getObject(index);
            if (raw == null) {
                return null;
            }
            if (raw instanceof Blob) {
                return "<binary " + ((Blob) raw).length() + " bytes>";
            }
            if (raw instanceof byte[]) {
                return "<binary " + ((byte[]) raw).length + " bytes>";
            }
            return raw.toString();
        }
        if (SqlTypes.isClobType(sqlType)) {
            Clob clob = rs.getClob(index);
            return clob == null ? null : clob.getSubString(1, (int) Math.min(clob.length(), Integer.MAX_VALUE));
        }
        Object value = rs.getObject(index);
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value != null && SqlTypes.isTemporal(sqlType)) {
            return value.toString();
        }
        return value;
    }

    @Getter
    @RequiredArgsConstructor
    public static final class Page {
        private final List<Map<String, Object>> rows;
        private final long totalRows;
    }
}
