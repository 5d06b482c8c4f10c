package com.example.dbjobs.enums;

/**
 * 作业执行状态机
 * PENDING -> RUNNING -> {COMPLETED, FAILED, CANCELLED}
 * RETRYING 只是分类用的派生状态，重试本身是一条新的 PENDING 记录
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    RETRYING;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        switch (this) {
            case PENDING:
                // 执行器还没起来就出错的情况，也允许直接失败
                return target == RUNNING || target == FAILED;
            case RUNNING:
                return target == COMPLETED || target == FAILED || target == CANCELLED;
            default:
                return false;
        }
    }
}
