package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CronValidation {
    private boolean valid;
    private String error;
}
