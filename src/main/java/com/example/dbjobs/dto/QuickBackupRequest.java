package com.example.dbjobs.dto;

import lombok.Data;

/**
 * 一键备份
 */
@Data
public class QuickBackupRequest {
    private Long connectionId;
    private String databaseName;
    private String backupType = "full";
    private boolean compressionEnabled = true;
    private int retentionDays = 30;
    private String storagePath;
    private String format = "custom";
}
