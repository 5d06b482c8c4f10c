package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcedureInfo {
    private String name;
    /**
     * FUNCTION / PROCEDURE
     */
    private String type;
    private String returnType;
    private String definition;
}
