package com.chicu.botjobs.engine;

import com.chicu.botjobs.config.BotJobsProperties;
import com.chicu.botjobs.domain.JobEntity;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Чистые вычисления следующего срабатывания. Без побочных эффектов:
 * время и пояс передаются снаружи.
 */
@Component
public class RecurrenceEngine {

    private final Duration overdueGrace;

    public RecurrenceEngine(BotJobsProperties properties) {
        Duration grace = properties.getScheduler().getOverdueGrace();
        this.overdueGrace = grace == null || grace.isNegative() ? Duration.ZERO : grace;
    }

    /**
     * Первое срабатывание при загрузке задачи (старт процесса или создание).
     */
    public FireSchedule firstFire(JobEntity job, ZoneId zone, Instant now) {
        if (job.isFixedPattern()) {
            return pattern(job, zone, now);
        }

        RecurrenceRule rule = ruleOf(job);
        Instant fireAt = job.getFireAt();

        if (rule == null) {
            if (fireAt == null) {
                throw new IllegalArgumentException("One-shot job has no fireAt: id=" + job.getId());
            }
            // просроченное одноразовое — отдаём с небольшой задержкой, а не теряем
            return FireSchedule.absolute(fireAt.isAfter(now) ? fireAt : now.plus(overdueGrace));
        }

        if (fireAt == null) {
            return FireSchedule.absolute(rule.applyTo(now, zone));
        }
        return FireSchedule.absolute(catchUp(fireAt, rule, zone, now));
    }

    /**
     * Следующее срабатывание повторяющейся задачи после того, как она сработала.
     * Минимум один шаг правила от сохранённого fireAt, дальше догоняем now.
     */
    public FireSchedule nextAfterFire(JobEntity job, ZoneId zone, Instant now) {
        if (job.isFixedPattern()) {
            return pattern(job, zone, now);
        }

        RecurrenceRule rule = ruleOf(job);
        if (rule == null) {
            throw new IllegalStateException("Repeating job has no recurrence rule: id=" + job.getId());
        }

        Instant base = job.getFireAt() != null ? job.getFireAt() : now;
        return FireSchedule.absolute(catchUp(rule.applyTo(base, zone), rule, zone, now));
    }

    /**
     * Сдвигает fireAt правилом, пока он не станет строго позже now.
     * Число шагов ограничено (now - fireAt) / шаг + 1.
     */
    public Instant catchUp(Instant fireAt, RecurrenceRule rule, ZoneId zone, Instant now) {
        Instant next = fireAt;
        while (!next.isAfter(now)) {
            next = rule.applyTo(next, zone);
        }
        return next;
    }

    private FireSchedule pattern(JobEntity job, ZoneId zone, Instant now) {
        String cron = toSpringCron(job.getRecurrenceRule());
        ZonedDateTime next = parseCron(cron).next(now.atZone(zone));
        if (next == null) {
            throw new IllegalArgumentException("Cron pattern never fires: '" + job.getRecurrenceRule() + "'");
        }
        return FireSchedule.pattern(next.toInstant(), cron, zone);
    }

    private static RecurrenceRule ruleOf(JobEntity job) {
        String raw = job.getRecurrenceRule();
        if (raw == null || raw.isBlank()) return null;
        return RecurrenceRule.parse(raw);
    }

    /**
     * Классический 5-польный cron ("0 9 * * 1") дополняется секундами.
     */
    public static String toSpringCron(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    /**
     * @throws IllegalArgumentException если шаблон не разбирается
     */
    public static CronExpression parseCron(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Cron pattern is empty");
        }
        return CronExpression.parse(toSpringCron(raw));
    }
}
