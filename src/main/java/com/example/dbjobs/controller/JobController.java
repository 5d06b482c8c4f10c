package com.example.dbjobs.controller;

import com.example.dbjobs.dto.CronValidation;
import com.example.dbjobs.dto.JobRequest;
import com.example.dbjobs.dto.JobValidation;
import com.example.dbjobs.dto.QuickBackupRequest;
import com.example.dbjobs.entity.JobExecution;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.enums.TriggerSource;
import com.example.dbjobs.service.JobManager;
import com.example.dbjobs.service.JobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobManager jobManager;
    private final JobScheduler jobScheduler;

    // ===========================
    // 作业
    // ===========================

    @GetMapping
    public List<ScheduledJob> list() {
        return jobManager.listJobs();
    }

    @GetMapping("/{id}")
    public ScheduledJob get(@PathVariable Long id) {
        return jobManager.getJob(id);
    }

    @PostMapping
    public ScheduledJob create(@RequestBody JobRequest request,
                               @RequestHeader(value = "X-User-Id", required = false) Long actorId) {
        return jobManager.createJob(request, actorId);
    }

    @PutMapping("/{id}")
    public ScheduledJob update(@PathVariable Long id, @RequestBody JobRequest request) {
        return jobManager.updateJob(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        jobManager.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 启用 / 停用；启用会清零连续失败数
     */
    @PostMapping("/{id}/active")
    public ScheduledJob setActive(@PathVariable Long id, @RequestParam boolean value) {
        return jobManager.setJobActive(id, value);
    }

    @PostMapping("/{id}/execute")
    public JobExecution execute(@PathVariable Long id,
                                @RequestHeader(value = "X-User-Id", required = false) Long actorId) {
        return jobManager.executeJob(id, actorId, TriggerSource.MANUAL);
    }

    @GetMapping("/{id}/next-runs")
    public List<Instant> nextRuns(@PathVariable Long id, @RequestParam(defaultValue = "5") int count) {
        return jobManager.previewNextRuns(id, Math.min(Math.max(count, 1), 50));
    }

    @GetMapping("/{id}/validate")
    public JobValidation validate(@PathVariable Long id) {
        return jobManager.validateJob(id);
    }

    @PostMapping("/quick-backup")
    public JobExecution quickBackup(@RequestBody QuickBackupRequest request,
                                    @RequestHeader(value = "X-User-Id", required = false) Long actorId) {
        return jobManager.quickBackup(request, actorId);
    }

    // ===========================
    // 执行记录
    // ===========================

    @GetMapping("/{id}/executions")
    public Page<JobExecution> executions(@PathVariable Long id,
                                         @RequestParam(defaultValue = "0") int page,
                                         @RequestParam(defaultValue = "20") int size) {
        return jobManager.listExecutions(id, PageRequest.of(page, size));
    }

    @GetMapping("/executions/{executionId}")
    public JobExecution execution(@PathVariable Long executionId) {
        return jobManager.getExecution(executionId);
    }

    @GetMapping(value = "/executions/{executionId}/logs", produces = MediaType.TEXT_PLAIN_VALUE)
    public String executionLogs(@PathVariable Long executionId) {
        return jobManager.getExecutionLogs(executionId);
    }

    @PostMapping("/executions/{executionId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable Long executionId) {
        boolean cancelled = jobManager.cancelExecution(executionId);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/executions/{executionId}/download")
    public ResponseEntity<FileSystemResource> download(@PathVariable Long executionId) {
        Path file = jobManager.resolveBackupArtifact(executionId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.getFileName() + "\"")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(new FileSystemResource(file));
    }

    // ===========================
    // Cron 工具
    // ===========================

    @GetMapping("/cron/presets")
    public Map<String, String> presets() {
        return jobScheduler.presets();
    }

    @GetMapping("/cron/validate")
    public Map<String, Object> validateCron(@RequestParam String expression,
                                            @RequestParam(defaultValue = "UTC") String timezone,
                                            @RequestParam(defaultValue = "5") int count) {
        CronValidation validation = jobScheduler.validateCronExpression(expression);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", validation.isValid());
        body.put("error", validation.getError());
        if (validation.isValid()) {
            body.put("next_runs", jobScheduler.calculateNextNRuns(expression, Math.min(Math.max(count, 1), 50), timezone));
        }
        return body;
    }
}
