package com.example.dbjobs.service;

import com.example.dbjobs.dto.CronValidation;
import com.example.dbjobs.entity.ScheduledJob;
import com.example.dbjobs.exception.ConfigurationException;
import com.example.dbjobs.repository.ScheduledJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:02:00Z");

    @Mock private ScheduledJobRepository jobRepo;

    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new JobScheduler(jobRepo, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("每 5 分钟: 00:02 之后的下一次是 00:05")
    void nextRun_everyFiveMinutes() {
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), scheduler.calculateNextRun("*/5 * * * *", "UTC"));
    }

    @Test
    @DisplayName("下一次执行严格晚于基准时间")
    void nextRun_strictlyAfterBase() {
        Instant base = Instant.parse("2026-01-01T00:05:00Z");
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), scheduler.calculateNextRun("*/5 * * * *", "UTC", base));
    }

    @Test
    @DisplayName("时区: 纽约早上 9 点在夏令时切换当天对应 13:00Z")
    void nextRun_dstSpringForward() {
        Instant base = Instant.parse("2026-03-07T15:00:00Z");
        // 3 月 8 日切到 EDT (UTC-4)
        assertEquals(Instant.parse("2026-03-08T13:00:00Z"),
                scheduler.calculateNextRun("0 9 * * *", "America/New_York", base));
    }

    @Test
    @DisplayName("时区: 切换前一天仍按 EST (UTC-5)")
    void nextRun_beforeDst() {
        Instant base = Instant.parse("2026-03-06T15:00:00Z");
        assertEquals(Instant.parse("2026-03-07T14:00:00Z"),
                scheduler.calculateNextRun("0 9 * * *", "America/New_York", base));
    }

    @Test
    @DisplayName("相同输入计算结果一致")
    void nextRun_idempotent() {
        Instant first = scheduler.calculateNextRun("15 3 * * 1", "Asia/Shanghai");
        Instant second = scheduler.calculateNextRun("15 3 * * 1", "Asia/Shanghai");
        assertEquals(first, second);
    }

    @Test
    @DisplayName("连续 N 次执行时间")
    void nextNRuns() {
        List<Instant> runs = scheduler.calculateNextNRuns("0 * * * *", 3, "UTC");
        assertEquals(List.of(
                Instant.parse("2026-01-01T01:00:00Z"),
                Instant.parse("2026-01-01T02:00:00Z"),
                Instant.parse("2026-01-01T03:00:00Z")), runs);
    }

    @Test
    @DisplayName("6 段式的秒在最后一段，宏也接受")
    void validate_secondsLastAndMacros() {
        assertEquals(Instant.parse("2026-01-01T12:00:30Z"), scheduler.calculateNextRun("0 12 * * 1-5 30", "UTC"));
        assertFalse(scheduler.validateCronExpression("0 0 12 * * MON-FRI").isValid());
        assertTrue(scheduler.validateCronExpression("@daily").isValid());
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), scheduler.calculateNextRun("@daily", "UTC"));
        assertEquals(Instant.parse("2027-01-01T00:00:00Z"), scheduler.calculateNextRun("@YEARLY", "UTC"));
        assertFalse(scheduler.validateCronExpression("@fortnightly").isValid());
    }

    @Test
    @DisplayName("日、周都有限定时任一匹配即触发: 13 号或周五")
    void nextRun_dayOfMonthOrDayOfWeek() {
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        // 2026-01-02 是周五
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), scheduler.calculateNextRun("0 0 13 * 5", "UTC", base));
        assertEquals(Instant.parse("2026-01-13T00:00:00Z"),
                scheduler.calculateNextRun("0 0 13 * 5", "UTC", Instant.parse("2026-01-09T00:00:00Z")));
        // 日字段以 * 开头时两者同时满足: 奇数号的周五
        assertEquals(Instant.parse("2026-01-13T00:00:00Z"), scheduler.calculateNextRun("0 0 13 * *", "UTC", base));
        assertEquals(Instant.parse("2026-01-09T00:00:00Z"), scheduler.calculateNextRun("0 0 */2 * 5", "UTC", base));
    }

    @Test
    @DisplayName("非法 cron: 校验返回错误，计算抛配置异常")
    void invalidCron() {
        CronValidation validation = scheduler.validateCronExpression("61 * * * *");
        assertFalse(validation.isValid());
        assertNotNull(validation.getError());

        assertFalse(scheduler.validateCronExpression("* * *").isValid());
        assertFalse(scheduler.validateCronExpression("  ").isValid());
        assertThrows(ConfigurationException.class, () -> scheduler.calculateNextRun("not a cron", "UTC"));
    }

    @Test
    @DisplayName("非法时区抛配置异常")
    void invalidTimezone() {
        assertThrows(ConfigurationException.class, () -> scheduler.calculateNextRun("0 * * * *", "Mars/Olympus"));
    }

    @Test
    @DisplayName("isDue: 启用且 nextRunAt 已到")
    void isDue() {
        ScheduledJob job = new ScheduledJob();
        job.setCronExpression("*/5 * * * *");
        job.setNextRunAt(Instant.parse("2026-01-01T00:00:00Z"));
        assertTrue(scheduler.isDue(job));

        job.setNextRunAt(Instant.parse("2026-01-01T00:05:00Z"));
        assertFalse(scheduler.isDue(job));
        assertTrue(scheduler.isDue(job, Instant.parse("2026-01-01T00:05:00Z")));

        job.setActive(false);
        assertFalse(scheduler.isDue(job, Instant.parse("2026-01-01T01:00:00Z")));
    }

    @Test
    @DisplayName("updateNextRun: 没有 cron 时置空并保存")
    void updateNextRun_noCron() {
        ScheduledJob job = new ScheduledJob();
        job.setNextRunAt(NOW);
        scheduler.updateNextRun(job);
        assertNull(job.getNextRunAt());
        verify(jobRepo).save(job);
    }

    @Test
    @DisplayName("updateNextRun: 计算出错时保留原值")
    void updateNextRun_errorKeepsValue() {
        ScheduledJob job = new ScheduledJob();
        job.setId(7L);
        job.setCronExpression("bogus");
        job.setNextRunAt(NOW);
        scheduler.updateNextRun(job);
        assertEquals(NOW, job.getNextRunAt());
        verify(jobRepo, never()).save(any());
    }

    @Test
    @DisplayName("预置表达式")
    void presets() {
        assertEquals("0 2 * * *", scheduler.getPresetCron("daily_2am"));
        assertEquals("*/15 * * * *", scheduler.getPresetCron("EVERY_15_MINUTES"));
        assertNull(scheduler.getPresetCron("yearly"));
        for (String cron : scheduler.presets().values()) {
            assertTrue(scheduler.validateCronExpression(cron).isValid(), cron);
        }
    }
}
