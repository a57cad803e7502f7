package com.chicu.botjobs.engine;

import com.chicu.botjobs.common.enums.ScheduleKind;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Что взводить: конкретный момент или cron-шаблон.
 * Для FIXED_PATTERN fireAt — ближайшее срабатывание, только для логов.
 */
public record FireSchedule(Instant fireAt, ScheduleKind kind, String cron, ZoneId zone) {

    public static FireSchedule absolute(Instant fireAt) {
        return new FireSchedule(fireAt, ScheduleKind.ABSOLUTE, null, null);
    }

    public static FireSchedule pattern(Instant nextFire, String cron, ZoneId zone) {
        return new FireSchedule(nextFire, ScheduleKind.FIXED_PATTERN, cron, zone);
    }

    public boolean isPattern() {
        return kind == ScheduleKind.FIXED_PATTERN;
    }
}
