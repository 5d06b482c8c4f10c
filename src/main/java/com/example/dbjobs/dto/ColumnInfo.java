package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnInfo {
    private String name;
    private String dataType;
    private boolean nullable;
    private String defaultValue;
    private boolean primaryKey;
    private boolean foreignKey;
}
