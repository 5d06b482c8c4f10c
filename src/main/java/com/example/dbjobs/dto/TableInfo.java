package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableInfo {
    private String name;
    private String schema;
    private Long rowCount;
    private Long sizeBytes;
    /**
     * table / view / materialized_view / collection
     */
    private String tableType;

    public TableInfo(String name, String schema, String tableType) {
        this(name, schema, null, null, tableType);
    }
}
