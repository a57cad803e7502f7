package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.engine.FireSchedule;
import com.chicu.botjobs.engine.RecurrenceEngine;
import com.chicu.botjobs.engine.TimerTable;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.service.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderSchedulerImpl implements ReminderScheduler {

    private final JobStore jobStore;
    private final TimerTable timers;
    private final RecurrenceEngine recurrence;
    private final ReminderDispatcher dispatcher;
    private final OwnerZoneService zones;
    private final Clock clock;

    // ==============================================================
    // ▶️ LOAD
    // ==============================================================
    @Override
    public int loadAll() {
        List<JobEntity> reminders = jobStore.list(JobKind.REMINDER, null);

        int armed = 0;
        for (JobEntity reminder : reminders) {
            try {
                if (load(reminder)) armed++;
            } catch (RuntimeException e) {
                log.error("❌ Reminder load failed: id={} : {}", reminder.getId(), e.getMessage(), e);
            }
        }

        log.info("⏱ Reminders loaded: total={} armed={}", reminders.size(), armed);
        return armed;
    }

    @Override
    public boolean load(JobEntity reminder) {
        String id = reminder.getId();

        if (timers.isArmed(id)) {
            log.info("↩️ Reminder already queued: id={}", id);
            return false;
        }

        ZoneId zone = zones.resolve(reminder);
        FireSchedule schedule = recurrence.firstFire(reminder, zone, clock.instant());

        boolean armed = schedule.isPattern()
                ? timers.armPattern(id, schedule.cron(), schedule.zone(), () -> onFire(id))
                : timers.arm(id, schedule.fireAt(), () -> onFire(id));

        if (armed) {
            log.info("📌 Reminder queued: id={} next={} kind={}", id, schedule.fireAt(), schedule.kind());
        }
        return armed;
    }

    // ==============================================================
    // 🔔 FIRE
    // ==============================================================
    @Override
    public void onFire(String id) {
        Optional<JobEntity> current;
        try {
            current = jobStore.get(id);
        } catch (RuntimeException e) {
            log.error("❌ Reminder fetch failed on fire: id={} : {}", id, e.getMessage(), e);
            // сработавший таймер не должен блокировать повторную загрузку (loadAll / reload)
            timers.cancel(id);
            return;
        }

        if (current.isEmpty()) {
            log.info("Reminder gone before firing: id={}", id);
            timers.cancel(id);
            return;
        }

        JobEntity reminder = current.get();

        try {
            dispatcher.dispatch(reminder);
        } catch (Exception e) {
            // отправка не должна блокировать перевзвод/удаление
            log.error("❌ Reminder dispatch failed: id={} owner={} : {}",
                    id, reminder.getOwner(), e.getMessage(), e);
        }

        try {
            settle(reminder);
        } catch (RuntimeException e) {
            log.error("❌ Reminder bookkeeping failed: id={} : {}", id, e.getMessage(), e);
        }
    }

    private void settle(JobEntity reminder) {
        String id = reminder.getId();

        if (reminder.isFixedPattern()) {
            // cron-таймер перезапускается сам
            return;
        }

        if (reminder.isRepeat()) {
            timers.cancel(id);

            Instant now = clock.instant();
            Instant next = recurrence.nextAfterFire(reminder, zones.resolve(reminder), now).fireAt();
            jobStore.update(id, JobUpdate.builder().fireAt(next).build());

            Optional<JobEntity> fresh = jobStore.get(id);
            if (fresh.isEmpty()) {
                log.info("Reminder removed while rescheduling: id={}", id);
                return;
            }

            log.info("🔁 Reminder rescheduled: id={} next={}", id, next);
            load(fresh.get());
            return;
        }

        log.info("Deleting reminder: id={}", id);
        timers.cancel(id);
        int deleted = jobStore.remove(id);
        if (deleted > 0) {
            log.info("🗑 Reminder deleted: id={}", id);
        } else {
            log.info("Reminder already removed: id={}", id);
        }
    }

    // ==============================================================
    // ⏹ CANCEL / STATUS
    // ==============================================================
    @Override
    public void cancel(String id) {
        log.debug("Cancelling reminder: id={}", id);
        timers.cancel(id);
    }

    @Override
    public boolean isLoaded(String id) {
        return timers.isArmed(id);
    }
}
