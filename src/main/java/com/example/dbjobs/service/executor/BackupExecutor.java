package com.example.dbjobs.service.executor;

import com.example.dbjobs.config.AppProperties;
import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.dto.ExecutionResult;
import com.example.dbjobs.dto.ValidationResult;
import com.example.dbjobs.enums.BackupType;
import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.enums.JobType;
import com.example.dbjobs.exception.ExecutionCancelledException;
import com.example.dbjobs.util.ConfigValues;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;

/**
 * 调用 pg_dump / mysqldump 做备份
 * <p>
 * 配置: database_name, backup_type (full/schema_only/data_only), compression_enabled, format (custom/plain/tar，仅 PostgreSQL),
 * retention_days, storage_path, timeout_seconds
 * 密码只通过子进程环境变量 (PGPASSWORD / MYSQL_PWD) 传递，不出现在命令行
 */
public class BackupExecutor extends AbstractJobExecutor {
    public static final String DATABASE_NAME = "database_name";
    public static final String BACKUP_TYPE = "backup_type";
    public static final String COMPRESSION_ENABLED = "compression_enabled";
    public static final String FORMAT = "format";
    public static final String RETENTION_DAYS = "retention_days";
    public static final String STORAGE_PATH = "storage_path";
    public static final String TIMEOUT_SECONDS = "timeout_seconds";

    public static final String RESULT_BACKUP_PATH = "backup_path";

    private static final Set<String> FORMATS = Set.of("custom", "plain", "tar");
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final int MAX_ERROR_CHARS = 4000;

    private final AppProperties.Backup settings;

    public BackupExecutor(ExecutionContext context, AppProperties.Backup settings) {
        super(context);
        this.settings = settings;
    }

    @Override
    public JobType getJobType() {
        return JobType.DATABASE_BACKUP;
    }

    private DatabaseType dbType() {
        return context.getTarget() == null ? null : context.getTarget().getDbType();
    }

    String databaseName() {
        String fallback = context.getTarget() == null ? null : context.getTarget().getDatabase();
        return ConfigValues.getString(config, DATABASE_NAME, fallback);
    }

    String backupTypeCode() {
        return ConfigValues.getString(config, BACKUP_TYPE, BackupType.FULL.getCode());
    }

    String format() {
        return ConfigValues.getString(config, FORMAT, "custom");
    }

    boolean compression() {
        return ConfigValues.getBoolean(config, COMPRESSION_ENABLED, true);
    }

    Path storageRoot() {
        return Paths.get(ConfigValues.getString(config, STORAGE_PATH, settings.getStorageRoot()));
    }

    @Override
    public ValidationResult validateConfig() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        DatabaseType type = dbType();
        if (type == null) {
            errors.add("Missing required field: database_type");
        } else if (type != DatabaseType.POSTGRESQL && !type.isMysqlFamily()) {
            errors.add("Unsupported database type for backup: " + type);
        }

        String database = databaseName();
        if (StringUtils.isBlank(database)) {
            errors.add("Missing required field: database_name");
        } else if (database.startsWith("-")) {
            errors.add("Invalid database name: " + database);
        }

        if (BackupType.fromCode(backupTypeCode()).isEmpty()) {
            errors.add("Invalid backup type: " + backupTypeCode());
        }
        if (!FORMATS.contains(format())) {
            errors.add("Invalid backup format: " + format());
        } else if (type != null && type.isMysqlFamily() && !"custom".equals(format()) && !"plain".equals(format())) {
            warnings.add("Format '" + format() + "' is ignored for MySQL, output is plain SQL");
        }

        Path root = storageRoot();
        try {
            Files.createDirectories(root);
            if (!Files.isWritable(root)) {
                errors.add("Storage path not writable: " + root);
            }
        } catch (IOException e) {
            errors.add("Storage path not writable: " + root);
        }
        return ValidationResult.of(errors, warnings);
    }

    /**
     * {database}_{backupType}_{yyyyMMdd_HHmmss}.{ext}[.gz]
     */
    String buildFileName(Instant now) {
        String base = databaseName() + "_" + backupTypeCode() + "_" + FILE_TIMESTAMP.format(now);
        if (dbType() == DatabaseType.POSTGRESQL) {
            String ext;
            switch (format()) {
                case "plain":
                    ext = ".sql";
                    break;
                case "tar":
                    ext = ".tar";
                    break;
                default:
                    ext = ".dump";
            }
            return base + ext + (compression() ? ".gz" : "");
        }
        return base + (compression() ? ".sql.gz" : ".sql");
    }

    @Override
    protected ExecutionResult doExecute(Long executionId) {
        Instant now = context.getClock().instant();
        String backupType = backupTypeCode();
        boolean compression = compression();
        long timeoutSeconds = ConfigValues.getLong(config, TIMEOUT_SECONDS, settings.getTimeoutSeconds());
        ConnectionTarget target = context.getTarget();

        logInfo("Target: {} on {}:{}", target.getDbType(), target.getHost(), target.getPort());
        logInfo("Database: {}", databaseName());
        logInfo("Backup type: {}", backupType);
        logInfo("Compression: {}", compression);
        logInfo("Storage path: {}", storageRoot());

        String fileName = buildFileName(now);
        Path backupPath = storageRoot().resolve(fileName);
        logInfo("Backup file: {}", backupPath);

        Path rawDump = null;
        Path stderrFile = null;
        try {
            stderrFile = Files.createTempFile("backup-" + executionId + "-", ".err");
            boolean ok;
            if (target.getDbType() == DatabaseType.POSTGRESQL) {
                ok = runDump(executionId, buildPgDumpCommand(backupPath), "PGPASSWORD", null, stderrFile, timeoutSeconds);
            } else if (compression) {
                // mysqldump 只输出明文，先落临时文件再在进程内压缩
                rawDump = Files.createTempFile(storageRoot(), "." + fileName, ".part");
                ok = runDump(executionId, buildMysqldumpCommand(), "MYSQL_PWD", rawDump, stderrFile, timeoutSeconds);
                if (ok) {
                    logInfo("Compressing backup file...");
                    gzip(rawDump, backupPath);
                }
            } else {
                ok = runDump(executionId, buildMysqldumpCommand(), "MYSQL_PWD", backupPath, stderrFile, timeoutSeconds);
            }

            if (!ok) {
                String error = readError(stderrFile);
                deletePartial(backupPath);
                return failure(error, null);
            }

            long size = Files.size(backupPath);
            String checksum;
            try (InputStream in = Files.newInputStream(backupPath)) {
                checksum = DigestUtils.sha256Hex(in);
            }
            int retentionDays = ConfigValues.getInt(config, RETENTION_DAYS, 30);
            Instant expiresAt = now.plus(retentionDays, ChronoUnit.DAYS);

            logInfo("Backup completed successfully");
            logInfo("File size: {} bytes ({} MB)", size, String.format("%.2f", size / 1024.0 / 1024.0));
            logInfo("Checksum (SHA256): {}", checksum);

            Map<String, Object> resultData = new LinkedHashMap<>();
            resultData.put(RESULT_BACKUP_PATH, backupPath.toAbsolutePath().toString());
            resultData.put("backup_filename", fileName);
            resultData.put("file_size_bytes", size);
            resultData.put("file_size_mb", Math.round(size / 1024.0 / 1024.0 * 100) / 100.0);
            resultData.put("checksum", checksum);
            resultData.put("backup_type", backupType);
            resultData.put("compression_enabled", compression);
            resultData.put("retention_days", retentionDays);
            resultData.put("expires_at", expiresAt.toString());
            return ExecutionResult.builder().success(true).resultData(resultData).build();
        } catch (IOException e) {
            logError("Backup failed: {}", e.getMessage());
            deletePartial(backupPath);
            return failure(e.getMessage(), e);
        } catch (RuntimeException e) {
            deletePartial(backupPath);
            throw e;
        } finally {
            deleteQuietly(rawDump);
            deleteQuietly(stderrFile);
        }
    }

    List<String> buildPgDumpCommand(Path backupPath) {
        ConnectionTarget target = context.getTarget();
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.getPgDumpPath());
        cmd.add("-h");
        cmd.add(StringUtils.defaultIfBlank(target.getHost(), "localhost"));
        cmd.add("-p");
        cmd.add(String.valueOf(target.getPort() == null ? DatabaseType.POSTGRESQL.getDefaultPort() : target.getPort()));
        if (StringUtils.isNotBlank(target.getUsername())) {
            cmd.add("-U");
            cmd.add(target.getUsername());
        }
        cmd.add("-d");
        cmd.add(databaseName());
        cmd.add("-F");
        switch (format()) {
            case "plain":
                cmd.add("p");
                break;
            case "tar":
                cmd.add("t");
                break;
            default:
                cmd.add("c");
        }
        if (BackupType.SCHEMA_ONLY.getCode().equals(backupTypeCode())) {
            cmd.add("--schema-only");
        } else if (BackupType.DATA_ONLY.getCode().equals(backupTypeCode())) {
            cmd.add("--data-only");
        }
        if (compression()) {
            cmd.add("-Z");
            cmd.add("6");
        }
        cmd.add("-f");
        cmd.add(backupPath.toString());
        return cmd;
    }

    List<String> buildMysqldumpCommand() {
        ConnectionTarget target = context.getTarget();
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.getMysqldumpPath());
        cmd.add("-h");
        cmd.add(StringUtils.defaultIfBlank(target.getHost(), "localhost"));
        cmd.add("-P");
        cmd.add(String.valueOf(target.getPort() == null ? DatabaseType.MYSQL.getDefaultPort() : target.getPort()));
        if (StringUtils.isNotBlank(target.getUsername())) {
            cmd.add("-u");
            cmd.add(target.getUsername());
        }
        if (BackupType.SCHEMA_ONLY.getCode().equals(backupTypeCode())) {
            cmd.add("--no-data");
        } else if (BackupType.DATA_ONLY.getCode().equals(backupTypeCode())) {
            cmd.add("--no-create-info");
        }
        cmd.add("--single-transaction");
        cmd.add(databaseName());
        return cmd;
    }

    /**
     * @param stdoutFile 为空时丢弃标准输出
     * @return 退出码为 0 返回 true
     */
    private boolean runDump(Long executionId, List<String> command, String passwordEnv, Path stdoutFile,
                            Path stderrFile, long timeoutSeconds) throws IOException {
        checkCancelled(executionId);
        logInfo("Executing: {} (password hidden)", command.get(0));

        ProcessBuilder pb = new ProcessBuilder(command);
        if (context.getTarget().getPassword() != null) {
            pb.environment().put(passwordEnv, context.getTarget().getPassword());
        }
        pb.redirectOutput(stdoutFile == null ? ProcessBuilder.Redirect.DISCARD : ProcessBuilder.Redirect.to(stdoutFile.toFile()));
        pb.redirectError(ProcessBuilder.Redirect.to(stderrFile.toFile()));

        Process process = pb.start();
        onCancel(executionId, process::destroyForcibly);
        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                logError("Backup timeout (exceeded {} seconds)", timeoutSeconds);
                Files.writeString(stderrFile, "Backup timeout (exceeded " + timeoutSeconds + " seconds)", StandardCharsets.UTF_8);
                return false;
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("执行 [" + executionId + "] 被中断");
        }
        if (isCancelled(executionId)) {
            throw new ExecutionCancelledException("执行 [" + executionId + "] 已被取消");
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            logError("{} exited with code {}", command.get(0), exitCode);
            return false;
        }
        logInfo("{} completed successfully", command.get(0));
        return true;
    }

    private static void gzip(Path source, Path target) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
            in.transferTo(out);
        }
    }

    private String readError(Path stderrFile) throws IOException {
        String error = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
        if (error.isEmpty()) {
            error = "Backup command failed";
        }
        String truncated = StringUtils.abbreviate(error, MAX_ERROR_CHARS);
        logError("Backup failed: {}", truncated);
        return truncated;
    }

    private void deletePartial(Path backupPath) {
        try {
            if (Files.deleteIfExists(backupPath)) {
                logInfo("Cleaned up partial backup file");
            }
        } catch (IOException e) {
            logWarn("Failed to delete partial backup file {}: {}", backupPath, e.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logWarn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }

    @Override
    public List<String> getRequiredPermissions() {
        String type = backupTypeCode();
        if (BackupType.SCHEMA_ONLY.getCode().equals(type)) {
            return List.of("SELECT", "SHOW VIEW");
        }
        if (BackupType.DATA_ONLY.getCode().equals(type)) {
            return List.of("SELECT");
        }
        return List.of("SELECT", "SHOW VIEW", "TRIGGER", "LOCK TABLES");
    }
}
