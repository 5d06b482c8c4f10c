package com.example.dbjobs.enums;

public enum HealthStatus {
    ONLINE,
    /**
     * 探测失败，但连续失败次数还没到阈值
     */
    DEGRADED,
    OFFLINE,
    UNKNOWN
}
