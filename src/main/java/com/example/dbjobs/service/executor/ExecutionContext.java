package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.service.ExecutionControlManager;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;

/**
 * 一次执行的输入：目标库、作业配置、超时与取消信号
 */
@Getter
@Builder
@ToString
public class ExecutionContext {
    private final ConnectionTarget target;
    @Builder.Default
    private final Map<String, Object> config = Collections.emptyMap();
    private final String targetSchema;
    @Builder.Default
    private final int maxRuntimeSeconds = 3600;
    /**
     * 可为空 (只做校验时)
     */
    @ToString.Exclude
    private final ExecutionControlManager control;
    @Builder.Default
    @ToString.Exclude
    private final Clock clock = Clock.systemUTC();
}
