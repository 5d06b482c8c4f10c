package com.example.dbjobs.config;

import com.example.dbjobs.service.SecretCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;

@Component
@Order(1) // 保证它最先执行 (优先级高)
@Slf4j
@RequiredArgsConstructor
public class StartupValidator implements ApplicationRunner {
    private final AppProperties config;
    private final DataSource dataSource;
    private final SecretCipher secretCipher;

    @Override
    public void run(ApplicationArguments args) {
        log.info(">>> 开始应用启动自检...");

        try {
            validateDatabase();
            validateCipher();
            validateBackupRoot();
            log.info("<<< 应用自检通过，服务正常启动。");
        } catch (Exception e) {
            log.error("************************************************************");
            log.error("FATAL ERROR: 应用启动自检失败，程序将退出！");
            log.error("错误详情: {}", e.getMessage());
            log.error("************************************************************");

            // 强制退出 JVM (非 0 状态码表示异常退出)
            System.exit(1);
        }
    }

    /**
     * 校验元数据库连接
     */
    private void validateDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(5)) { // 5秒超时
                throw new IllegalStateException("数据库连接无效");
            }
            log.info("数据库连接正常: {}", conn.getMetaData().getURL());
        } catch (Exception e) {
            throw new IllegalStateException("无法连接到元数据库，请检查 URL/User/Password 配置。(" + e.getMessage() + ")", e);
        }
    }

    /**
     * 加解密自测一次
     */
    private void validateCipher() {
        if (StringUtils.isBlank(config.getCrypto().getSecretKey())) {
            log.warn("app.crypto.secret-key 未配置，已保存的密码在重启后无法解密");
        }
        String probe = "startup-probe";
        String decrypted = secretCipher.decrypt(secretCipher.encrypt(probe)).orElse(null);
        if (!probe.equals(decrypted)) {
            throw new IllegalStateException("加解密自检失败");
        }
    }

    private void validateBackupRoot() throws IOException {
        Path root = Paths.get(config.getBackup().getStorageRoot());
        Files.createDirectories(root);
        if (!Files.isWritable(root)) {
            throw new IllegalStateException("备份目录不可写: " + root.toAbsolutePath());
        }
        log.info("备份目录: {}", root.toAbsolutePath());
    }
}
