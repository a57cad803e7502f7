package com.chicu.botjobs.watch;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.util.JobArgsCodec;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.host.CommandContext;
import com.chicu.botjobs.host.CommandExecutor;
import com.chicu.botjobs.host.DataProvider;
import com.chicu.botjobs.host.ItemInfo;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.service.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Разбор очереди отложенных WATCH-заявок и дозаполнение имён.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatchQueueProcessor {

    private final JobStore jobStore;
    private final CommandExecutor commandExecutor;
    private final DataProvider dataProvider;
    private final JobArgsCodec argsCodec;
    private final ExecutorService watchExecutor;

    /**
     * Очередь, затем имена. Запускается при старте.
     */
    public void processQueues() {
        drainQueue();
        backfillNames();
    }

    /**
     * Прогоняет каждую заявку как только что пришедшую команду,
     * ждёт все и удаляет всю очередь, как бы ни прошли отдельные заявки.
     *
     * @return сколько заявок обработано
     */
    public int drainQueue() {
        List<JobEntity> queued = jobStore.list(JobKind.WATCH_QUEUE, null);
        if (queued.isEmpty()) {
            log.debug("Watch queue is empty");
            return 0;
        }

        CompletableFuture<?>[] futures = queued.stream()
                .map(entry -> CompletableFuture.runAsync(() -> submitQueued(entry), watchExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();

        int cleared = jobStore.clear(JobKind.WATCH_QUEUE, null);
        log.info("📥 Watch queue drained: processed={} cleared={}", queued.size(), cleared);
        return queued.size();
    }

    private void submitQueued(JobEntity entry) {
        try {
            log.info("Processing queued watch: id={} owner={} args={}", entry.getId(), entry.getOwner(), entry.getArgs());
            commandExecutor.run(CommandContext.of(entry), argsCodec.toTokens(entry.getArgs()), false);
        } catch (Exception e) {
            log.error("❌ Queued watch failed: id={} owner={} : {}", entry.getId(), entry.getOwner(), e.getMessage(), e);
        }
    }

    @Scheduled(
            initialDelayString = "${botjobs.watch.backfill-interval:PT1H}",
            fixedDelayString = "${botjobs.watch.backfill-interval:PT1H}"
    )
    public void scheduledBackfill() {
        try {
            backfillNames();
        } catch (Exception e) {
            log.error("❌ Name backfill failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Дозаполняет displayName у WATCH-задач без имени. Best effort.
     *
     * @return сколько имён записано
     */
    public int backfillNames() {
        List<JobEntity> nameless = jobStore.list(JobKind.WATCH, null).stream()
                .filter(j -> j.getDisplayName() == null || j.getDisplayName().isBlank())
                .filter(j -> j.getItemId() != null && !j.getItemId().isBlank())
                .toList();

        if (nameless.isEmpty()) return 0;

        AtomicInteger filled = new AtomicInteger();
        CompletableFuture<?>[] futures = nameless.stream()
                .map(job -> CompletableFuture.runAsync(() -> {
                    if (resolveName(job)) filled.incrementAndGet();
                }, watchExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();

        log.info("🏷 Watch names backfilled: {}/{}", filled.get(), nameless.size());
        return filled.get();
    }

    private boolean resolveName(JobEntity job) {
        try {
            ItemInfo info = dataProvider.lookup(job.getItemId());
            if (info == null || info.displayName() == null || info.displayName().isBlank()) {
                log.debug("No display name for item: id={} itemId={}", job.getId(), job.getItemId());
                return false;
            }
            return jobStore.update(job.getId(), JobUpdate.builder().displayName(info.displayName()).build()) > 0;
        } catch (Exception e) {
            log.warn("⚠️ Name lookup failed: id={} itemId={} : {}", job.getId(), job.getItemId(), e.getMessage());
            return false;
        }
    }
}
