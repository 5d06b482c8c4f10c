package com.example.dbjobs.config;

import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.service.executor.BackupExecutor;
import com.example.dbjobs.service.executor.ConnectionOpener;
import com.example.dbjobs.service.executor.ExecutionContext;
import com.example.dbjobs.service.executor.JobExecutor;
import com.example.dbjobs.service.executor.JobExecutorFactory;
import com.example.dbjobs.service.executor.ProcedureExecutor;
import com.example.dbjobs.service.executor.ScriptExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 每种作业类型注册一个执行器工厂
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorFactoryConfig {

    private final ConnectionOpener connectionOpener;
    private final AppProperties appProperties;

    @Bean
    public JobExecutorFactory scriptExecutorFactory() {
        return new JobExecutorFactory() {
            @Override
            public JobType getJobType() {
                return JobType.SQL_SCRIPT;
            }

            @Override
            public JobExecutor create(ExecutionContext context) {
                return new ScriptExecutor(context, connectionOpener);
            }
        };
    }

    @Bean
    public JobExecutorFactory procedureExecutorFactory() {
        return new JobExecutorFactory() {
            @Override
            public JobType getJobType() {
                return JobType.STORED_PROCEDURE;
            }

            @Override
            public JobExecutor create(ExecutionContext context) {
                return new ProcedureExecutor(context, connectionOpener);
            }
        };
    }

    @Bean
    public JobExecutorFactory backupExecutorFactory() {
        return new JobExecutorFactory() {
            @Override
            public JobType getJobType() {
                return JobType.DATABASE_BACKUP;
            }

            @Override
            public JobExecutor create(ExecutionContext context) {
                return new BackupExecutor(context, appProperties.getBackup());
            }
        };
    }
}
