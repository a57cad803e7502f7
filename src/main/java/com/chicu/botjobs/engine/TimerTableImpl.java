package com.chicu.botjobs.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

@Slf4j
@Service
public class TimerTableImpl implements TimerTable {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    /** id → future таймера */
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    /** id → когда взведён */
    private final Map<String, Instant> armedAt = new ConcurrentHashMap<>();

    public TimerTableImpl(@Qualifier("jobTaskScheduler") TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    // ==============================================================
    // ▶️ ARM
    // ==============================================================
    @Override
    public boolean arm(String id, Instant fireAt, Runnable callback) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fireAt, "fireAt");
        Objects.requireNonNull(callback, "callback");

        boolean created = register(id, () -> taskScheduler.schedule(callback, fireAt));
        if (created) {
            log.info("⏱ Timer armed: id={} fireAt={}", id, fireAt);
        }
        return created;
    }

    @Override
    public boolean armPattern(String id, String cron, ZoneId zone, Runnable callback) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(cron, "cron");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(callback, "callback");

        CronTrigger trigger = new CronTrigger(cron, zone);
        boolean created = register(id, () -> taskScheduler.schedule(callback, trigger));
        if (created) {
            log.info("⏱ Timer armed: id={} cron='{}' zone={}", id, cron, zone);
        }
        return created;
    }

    private boolean register(String id, Supplier<ScheduledFuture<?>> scheduling) {
        boolean[] created = {false};

        timers.computeIfAbsent(id, k -> {
            armedAt.put(k, clock.instant());
            ScheduledFuture<?> future = scheduling.get();
            created[0] = true;
            return future;
        });

        if (!created[0]) {
            log.warn("⚠️ Timer already armed, skip: id={}", id);
        }
        return created[0];
    }

    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public void cancel(String id) {
        if (id == null) return;

        ScheduledFuture<?> future = timers.remove(id);
        armedAt.remove(id);

        if (future != null) {
            future.cancel(false);
            log.info("🛑 Timer cancelled: id={}", id);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isArmed(String id) {
        return id != null && timers.containsKey(id);
    }

    @Override
    public Set<String> armedIds() {
        return Set.copyOf(timers.keySet());
    }

    @Override
    public Optional<Instant> getArmedAt(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(armedAt.get(id));
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        log.info("💤 TimerTable shutting down, timers={}", timers.size());
        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        armedAt.clear();
    }
}
