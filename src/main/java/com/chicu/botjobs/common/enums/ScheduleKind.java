package com.chicu.botjobs.common.enums;

/**
 * Как трактуется расписание задачи.
 *
 * ABSOLUTE      — fireAt хранит конкретный момент, recurrenceRule (если есть) сдвигает его.
 * FIXED_PATTERN — recurrenceRule это cron-шаблон в часовом поясе задачи, fireAt не используется.
 */
public enum ScheduleKind {
    ABSOLUTE,
    FIXED_PATTERN
}
