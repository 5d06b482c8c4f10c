package com.example.dbjobs.enums;

public enum ConnectionMode {
    READ_WRITE,
    READ_ONLY,
    /**
     * 维护模式：允许运维作业，不对外提供查询
     */
    MAINTENANCE
}
