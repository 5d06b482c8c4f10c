package com.example.dbjobs.exception;

/**
 * 专用于“执行被取消”的控制流异常
 */
public class ExecutionCancelledException extends RuntimeException {
    public ExecutionCancelledException(String message) {
        super(message);
    }
}
