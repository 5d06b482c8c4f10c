package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcedureParameter {
    private String name;
    private String type;
    /**
     * IN / OUT / INOUT
     */
    private String mode;
    private int position;
}
