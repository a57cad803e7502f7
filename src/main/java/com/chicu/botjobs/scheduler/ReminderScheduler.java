package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.domain.JobEntity;

/**
 * Жизненный цикл таймеров напоминаний:
 * Unloaded → Armed → Fired → (Rearmed | Deleted).
 */
public interface ReminderScheduler {

    /**
     * Поднимает таймеры для всех REMINDER из хранилища (по порядку создания).
     * Уже взведённые пропускаются, повторный вызов ничего не дублирует.
     *
     * @return сколько таймеров взведено этим вызовом
     */
    int loadAll();

    /**
     * @return false, если таймер для id уже есть
     */
    boolean load(JobEntity reminder);

    /**
     * Снимает таймер. Запись в хранилище не трогает.
     */
    void cancel(String id);

    boolean isLoaded(String id);

    /**
     * Срабатывание таймера: отправка, затем перевзвод или удаление.
     */
    void onFire(String id);
}
