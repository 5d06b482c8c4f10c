package com.example.dbjobs.service;

import com.example.dbjobs.dto.CronValidation;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * cron 计算
 * <p>
 * 接受标准 5 段式 (分 时 日 月 周)、末尾带秒的 6 段式 (分 时 日 月 周 秒) 和 @daily 这类宏，
 * 字段语法交给 Spring {@link CronExpression} 解析。
 * 日、周两个字段都有限定 (不以 * 开头) 时按传统 cron 处理：任一字段匹配即可。
 * 匹配在作业自己的时区里做，结果统一换成 UTC 的 Instant 保存，夏令时切换按本地时间处理。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobScheduler {
    private static final Map<String, String> PRESETS;
    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    static {
        Map<String, String> presets = new LinkedHashMap<>();
        presets.put("hourly", "0 * * * *");
        presets.put("daily", "0 0 * * *");
        presets.put("daily_2am", "0 2 * * *");
        presets.put("weekly", "0 0 * * 0");
        presets.put("weekly_monday", "0 0 * * 1");
        presets.put("monthly", "0 0 1 * *");
        presets.put("every_5_minutes", "*/5 * * * *");
        presets.put("every_15_minutes", "*/15 * * * *");
        presets.put("every_30_minutes", "*/30 * * * *");
        PRESETS = Collections.unmodifiableMap(presets);
    }

    private final ScheduledJobRepository jobRepo;
    private final Clock clock;

    public CronValidation validateCronExpression(String expression) {
        try {
            parse(expression);
            return new CronValidation(true, null);
        } catch (IllegalArgumentException e) {
            return new CronValidation(false, e.getMessage());
        }
    }

    /**
     * 转成 Spring 的 "秒 分 时 日 月 周"；日、周都有限定时拆成两个表达式，取较早的触发时间
     */
    static List<CronExpression> parse(String expression) {
        if (StringUtils.isBlank(expression)) {
            throw new IllegalArgumentException("Cron expression must not be empty");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            String macro = MACROS.get(trimmed.toLowerCase(Locale.ROOT));
            if (macro == null) {
                throw new IllegalArgumentException("Unknown cron macro: " + trimmed);
            }
            trimmed = macro;
        }
        String[] fields = StringUtils.split(trimmed);
        if (fields.length != 5 && fields.length != 6) {
            throw new IllegalArgumentException("Cron expression must have 5 or 6 fields, found " + fields.length
                    + " in \"" + expression + "\"");
        }
        String second = fields.length == 6 ? fields[5] : "0";
        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
            return List.of(
                    CronExpression.parse(String.join(" ", second, minute, hour, dayOfMonth, month, "*")),
                    CronExpression.parse(String.join(" ", second, minute, hour, "*", month, dayOfWeek)));
        }
        return List.of(CronExpression.parse(String.join(" ", second, minute, hour, dayOfMonth, month, dayOfWeek)));
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !"?".equals(field);
    }

    public static ZoneId parseZone(String timezone) {
        if (StringUtils.isBlank(timezone)) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid timezone: " + timezone);
        }
    }

    public Instant calculateNextRun(String expression, String timezone) {
        return calculateNextRun(expression, timezone, null);
    }

    /**
     * @param baseTime 为空时取当前时间
     * @return 严格晚于 baseTime 的下一次触发时间 (UTC)
     */
    public Instant calculateNextRun(String expression, String timezone, Instant baseTime) {
        List<CronExpression> crons;
        try {
            crons = parse(expression);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid cron expression: " + e.getMessage(), e);
        }
        ZoneId zone = parseZone(timezone);
        Instant base = baseTime != null ? baseTime : clock.instant();
        ZonedDateTime next = null;
        for (CronExpression cron : crons) {
            ZonedDateTime candidate = cron.next(base.atZone(zone));
            if (candidate != null && (next == null || candidate.isBefore(next))) {
                next = candidate;
            }
        }
        if (next == null) {
            throw new ConfigurationException("Cron expression never fires: " + expression);
        }
        Instant result = next.toInstant();
        log.debug("下次执行时间: cron={}, tz={}, next={}", expression, zone, result);
        return result;
    }

    public List<Instant> calculateNextNRuns(String expression, int n, String timezone) {
        List<Instant> runs = new ArrayList<>(Math.max(0, n));
        Instant base = clock.instant();
        for (int i = 0; i < n; i++) {
            base = calculateNextRun(expression, timezone, base);
            runs.add(base);
        }
        return runs;
    }

    public boolean isDue(ScheduledJob job) {
        return isDue(job, null);
    }

    public boolean isDue(ScheduledJob job, Instant now) {
        if (!job.isActive() || StringUtils.isBlank(job.getCronExpression())) {
            return false;
        }
        Instant current = now != null ? now : clock.instant();
        return job.getNextRunAt() != null && !job.getNextRunAt().isAfter(current);
    }

    /**
     * 重新计算并保存 nextRunAt；没有 cron 的作业置空 (只能手动执行)
     * 计算出错时只记日志，保留原值，不保存
     */
    public void updateNextRun(ScheduledJob job) {
        if (refreshNextRun(job)) {
            jobRepo.save(job);
        }
    }

    /**
     * 同 {@link #updateNextRun}，只改实体不保存
     *
     * @return 计算出错时 false
     */
    public boolean refreshNextRun(ScheduledJob job) {
        if (StringUtils.isBlank(job.getCronExpression())) {
            job.setNextRunAt(null);
            return true;
        }
        try {
            Instant next = calculateNextRun(job.getCronExpression(), job.getTimezone());
            job.setNextRunAt(next);
            log.info("作业[{}] 下次执行时间: {}", job.getId(), next);
            return true;
        } catch (ConfigurationException e) {
            log.error("作业[{}] 计算下次执行时间失败: {}", job.getId(), e.getMessage());
            return false;
        }
    }

    public String getPresetCron(String preset) {
        if (preset == null) {
            return null;
        }
        return PRESETS.get(preset.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> presets() {
        return PRESETS;
    }
}
