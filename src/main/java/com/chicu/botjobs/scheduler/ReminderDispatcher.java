package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.domain.JobEntity;

/**
 * Кто обрабатывает сработавшее напоминание. Вызывается планировщиком напрямую.
 */
public interface ReminderDispatcher {

    void dispatch(JobEntity reminder);
}
