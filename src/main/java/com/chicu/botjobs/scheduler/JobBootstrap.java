package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.config.BotJobsProperties;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.watch.WatchQueueProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Старт: таймеры напоминаний, опись хранилища, очередь WATCH и имена.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobBootstrap {

    private final ReminderScheduler reminderScheduler;
    private final WatchQueueProcessor queueProcessor;
    private final JobStore jobStore;
    private final BotJobsProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getScheduler().isLoadOnStartup()) {
            log.info("Загрузка напоминаний при старте отключена (botjobs.scheduler.load-on-startup=false)");
            return;
        }

        reminderScheduler.loadAll();
        logInventory();

        try {
            queueProcessor.processQueues();
        } catch (Exception e) {
            log.error("❌ Startup queue processing failed: {}", e.getMessage(), e);
        }
    }

    private void logInventory() {
        log.info("Reminders");
        jobStore.list(JobKind.REMINDER, null).forEach(rm ->
                log.info("id={} owner={} channel={} fireAt={} repeat={} rule={} message={}",
                        rm.getId(), rm.getOwner(), rm.getChannelId(), rm.getFireAt(),
                        rm.isRepeat(), rm.getRecurrenceRule(), rm.getMessage()));

        log.info("Watches");
        jobStore.list(JobKind.WATCH, null).forEach(w ->
                log.info("id={} owner={} channel={} itemId={} args={} createdAt={}",
                        w.getId(), w.getOwner(), w.getChannelId(), w.getItemId(), w.getArgs(), w.getCreatedAt()));

        log.info("Watch queue");
        jobStore.list(JobKind.WATCH_QUEUE, null).forEach(q ->
                log.info("id={} owner={} channel={} args={}", q.getId(), q.getOwner(), q.getChannelId(), q.getArgs()));
    }
}
