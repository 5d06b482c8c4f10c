package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableSchema {
    private String tableName;
    private String schemaName;
    private List<ColumnInfo> columns;
    private List<String> primaryKeys;
    private List<Map<String, Object>> foreignKeys;
    private List<Map<String, Object>> indexes;
}
