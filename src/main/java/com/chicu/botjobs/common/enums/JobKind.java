package com.chicu.botjobs.common.enums;

/** Виды хранимых задач бота */
public enum JobKind {
    /** Напоминание: одноразовое или повторяющееся, держит таймер */
    REMINDER,
    /** Отслеживание внешнего значения, опрашивается по тику */
    WATCH,
    /** Отложенная заявка на WATCH, пришедшая пока бот был занят */
    WATCH_QUEUE,
    /** Часовой пояс владельца, одна запись на owner (id = owner) */
    TIMEZONE
}
