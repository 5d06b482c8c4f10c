package com.example.dbjobs.enums;

import java.util.Arrays;
import java.util.Optional;

public enum BackupType {
    FULL("full"),
    SCHEMA_ONLY("schema_only"),
    DATA_ONLY("data_only");

    private final String code;

    BackupType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<BackupType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code))
                .findFirst();
    }
}
