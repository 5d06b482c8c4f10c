package com.example.dbjobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app") // 对应 application.yml 中的 app:
public class AppProperties {

    private Crypto crypto = new Crypto();

    private Health health = new Health();

    private Connector connector = new Connector();

    private Scheduler scheduler = new Scheduler();

    private Backup backup = new Backup();

    private ThreadPool threadPool = new ThreadPool();

    @Data
    public static class Crypto {
        /**
         * AES 密钥 (base64，16/24/32 字节)
         * 生产环境通过环境变量 APP_CRYPTO_SECRET_KEY 注入
         */
        private String secretKey;
    }

    @Data
    public static class Health {
        // 连续失败多少次判定为 OFFLINE
        private int offlineThreshold = 3;
        // 巡检间隔 (毫秒)
        private long sweepIntervalMs = 60_000;
        private boolean sweepEnabled = true;
    }

    @Data
    public static class Connector {
        // 临时连接(测试/发现库)只用一个连接，超时短一些
        private int tempPoolSize = 1;
        private int tempTimeoutSeconds = 10;
        // 清理已断开连接器的间隔 (毫秒)
        private long cleanupIntervalMs = 300_000;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        // 轮询到期作业的间隔 (毫秒)
        private long pollIntervalMs = 10_000;
    }

    @Data
    public static class Backup {
        private String storageRoot = "./backups";
        private String pgDumpPath = "pg_dump";
        private String mysqldumpPath = "mysqldump";
        // 备份子进程超时，默认 1 小时
        private long timeoutSeconds = 3600;
    }

    @Data
    public static class ThreadPool {
        private PoolSize job = new PoolSize(4, 8, 100);
        private PoolSize health = new PoolSize(2, 4, 50);
    }

    @Data
    public static class PoolSize {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;

        public PoolSize() {
        }

        public PoolSize(int corePoolSize, int maxPoolSize, int queueCapacity) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
        }
    }

}
