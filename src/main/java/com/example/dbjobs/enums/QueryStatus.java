package com.example.dbjobs.enums;

public enum QueryStatus {
    SUCCESS,
    ERROR,
    TIMEOUT
}
