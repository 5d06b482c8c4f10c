package com.example.dbjobs.dto;

import com.example.dbjobs.enums.QueryStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 查询结果，预期内的失败(语法错误、超时)也用它返回，不抛异常
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {
    private QueryStatus status;
    private List<Map<String, Object>> rows;
    private List<String> columns;
    private int rowCount;
    private long executionTimeMs;
    private String errorMessage;

    public static QueryResult success(List<Map<String, Object>> rows, List<String> columns, long executionTimeMs) {
        return new QueryResult(QueryStatus.SUCCESS, rows, columns, rows.size(), executionTimeMs, null);
    }

    public static QueryResult error(String errorMessage, long executionTimeMs) {
        return new QueryResult(QueryStatus.ERROR, Collections.emptyList(), Collections.emptyList(), 0, executionTimeMs, errorMessage);
    }

    public static QueryResult timeout(String errorMessage, long executionTimeMs) {
        return new QueryResult(QueryStatus.TIMEOUT, Collections.emptyList(), Collections.emptyList(), 0, executionTimeMs, errorMessage);
    }

    public boolean isSuccess() {
        return status == QueryStatus.SUCCESS;
    }
}
