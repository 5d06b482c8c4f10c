package com.example.dbjobs.util;

import java.sql.Types;
import java.util.Locale;
import java.util.Set;

/**
 * JDBC 类型 / 数据库类型名的分类判断
 */
public final class SqlTypes {

    private static final Set<String> NUMERIC_TYPE_NAMES = Set.of(
            "int", "integer", "bigint", "smallint", "tinyint", "mediumint",
            "numeric", "decimal", "real", "float", "double", "double precision",
            "int2", "int4", "int8", "float4", "float8", "serial", "bigserial");

    private static final Set<String> BOOLEAN_TYPE_NAMES = Set.of("bool", "boolean", "bit");

    private SqlTypes() {
    }

    public static boolean isNumber(int sqlType) {
        return sqlType == Types.TINYINT || sqlType == Types.SMALLINT || sqlType == Types.INTEGER
                || sqlType == Types.BIGINT || sqlType == Types.NUMERIC || sqlType == Types.DECIMAL
                || isReal(sqlType);
    }

    public static boolean isReal(int sqlType) {
        return sqlType == Types.FLOAT || sqlType == Types.DOUBLE || sqlType == Types.REAL;
    }

    public static boolean isBlobType(int sqlType) {
        return sqlType == Types.BLOB || sqlType == Types.BINARY || sqlType == Types.VARBINARY
                || sqlType == Types.LONGVARBINARY;
    }

    public static boolean isClobType(int sqlType) {
        return sqlType == Types.CLOB || sqlType == Types.NCLOB;
    }

    public static boolean isTemporal(int sqlType) {
        return sqlType == Types.DATE || sqlType == Types.TIME || sqlType == Types.TIMESTAMP
                || sqlType == Types.TIME_WITH_TIMEZONE || sqlType == Types.TIMESTAMP_WITH_TIMEZONE;
    }

    /**
     * 声明的参数类型名是否为数值型，例如 "integer"、"numeric(10,2)"
     */
    public static boolean isNumericTypeName(String typeName) {
        return NUMERIC_TYPE_NAMES.contains(baseName(typeName));
    }

    public static boolean isBooleanTypeName(String typeName) {
        return BOOLEAN_TYPE_NAMES.contains(baseName(typeName));
    }

    /**
     * 值与声明类型是否明显不匹配 (只判断数值型和布尔型)
     */
    public static boolean isMismatch(String typeName, Object value) {
        if (typeName == null || value == null) {
            return false;
        }
        if (isNumericTypeName(typeName)) {
            if (value instanceof Number) {
                return false;
            }
            if (value instanceof String) {
                return !isNumericString((String) value);
            }
            return true;
        }
        if (isBooleanTypeName(typeName)) {
            if (value instanceof Boolean) {
                return false;
            }
            if (value instanceof String) {
                String s = ((String) value).trim().toLowerCase(Locale.ROOT);
                return !(s.equals("true") || s.equals("false"));
            }
            return true;
        }
        return false;
    }

    private static boolean isNumericString(String s) {
        try {
            new java.math.BigDecimal(s.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String baseName(String typeName) {
        if (typeName == null) {
            return "";
        }
        String name = typeName.trim().toLowerCase(Locale.ROOT);
        int paren = name.indexOf('(');
        if (paren > 0) {
            name = name.substring(0, paren).trim();
        }
        return name;
    }
}
