package com.example.dbjobs.enums;

public enum JobType {
    SQL_SCRIPT,
    STORED_PROCEDURE,
    DATABASE_BACKUP
}
