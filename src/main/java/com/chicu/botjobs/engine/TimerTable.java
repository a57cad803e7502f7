package com.chicu.botjobs.engine;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр живых таймеров по id задачи.
 *
 * Задача этого сервиса — только держать таймеры.
 * Он НЕ знает ни про хранилище, ни про повторы, ни про владельцев.
 * На один id — не больше одного живого таймера.
 */
public interface TimerTable {

    /**
     * Одноразовый таймер на момент fireAt.
     *
     * @return false, если для id уже есть таймер (новый не создаётся)
     */
    boolean arm(String id, Instant fireAt, Runnable callback);

    /**
     * Повторяющийся таймер по cron-шаблону в заданном поясе.
     * Перезапускается сам, пока его не отменят.
     *
     * @return false, если для id уже есть таймер
     */
    boolean armPattern(String id, String cron, ZoneId zone, Runnable callback);

    /**
     * Снимает таймер. Идемпотентно. Уже начатое выполнение не прерывается.
     */
    void cancel(String id);

    boolean isArmed(String id);

    Set<String> armedIds();

    /**
     * Когда таймер был взведён.
     */
    Optional<Instant> getArmedAt(String id);
}
