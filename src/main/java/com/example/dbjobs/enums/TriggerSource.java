package com.example.dbjobs.enums;

public enum TriggerSource {
    SCHEDULE,
    MANUAL,
    RETRY,
    API
}
