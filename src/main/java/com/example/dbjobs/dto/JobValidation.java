package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobValidation {
    private ValidationResult validation;
    private List<String> requiredPermissions;
}
