package com.chicu.botjobs.service;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.domain.JobEntity;

import java.util.List;
import java.util.Optional;

/**
 * Долговременное хранилище задач.
 *
 * Ошибки бэкенда (DataAccessException) пробрасываются вызывающему,
 * повторов внутри нет — политика ретраев на стороне вызывающего.
 * Отсутствующий id — не ошибка: пустой Optional или 0.
 */
public interface JobStore {

    /**
     * Сохраняет задачу и возвращает её id.
     * Для REMINDER сразу же взводит таймер (после коммита транзакции).
     */
    String insert(JobEntity job);

    Optional<JobEntity> get(String id);

    /**
     * @return число затронутых записей (0 или 1)
     */
    int update(String id, JobUpdate patch);

    /**
     * Обновляет запись, а если её нет — вставляет template под этим id.
     */
    int upsert(String id, JobUpdate patch, JobEntity template);

    /**
     * Удаляет запись. Таймер не трогает — это делает ReminderScheduler.
     */
    int remove(String id);

    /**
     * Задачи вида kind, по возрастанию createdAt.
     *
     * @param owner null — все владельцы
     */
    List<JobEntity> list(JobKind kind, String owner);

    /**
     * Массовое удаление. Для REMINDER сначала снимаются все таймеры,
     * чтобы не осталось висящих.
     */
    int clear(JobKind kind, String owner);
}
