package com.chicu.botjobs.watch;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.util.JobArgsCodec;
import com.chicu.botjobs.common.util.JobIds;
import com.chicu.botjobs.config.BotJobsProperties;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.host.CommandContext;
import com.chicu.botjobs.host.CommandExecutor;
import com.chicu.botjobs.host.CommandResult;
import com.chicu.botjobs.host.DataProvider;
import com.chicu.botjobs.host.NotificationSink;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.service.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Diff-опрос WATCH-задач: повторяет запрос и шлёт уведомление только если ответ изменился.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatchPoller {

    private final JobStore jobStore;
    private final CommandExecutor commandExecutor;
    private final DataProvider dataProvider;
    private final NotificationSink notificationSink;
    private final JobArgsCodec argsCodec;
    private final ExecutorService watchExecutor;
    private final BotJobsProperties properties;

    @Scheduled(cron = "${botjobs.watch.poll-cron:0 */1 * * * *}")
    public void scheduledPoll() {
        if (!properties.getWatch().isEnabled()) return;
        try {
            pollAll();
        } catch (Exception e) {
            log.error("❌ Watch tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Фоновый тик по всем владельцам. Изменения уходят в каналы.
     *
     * @return сколько записей изменилось
     */
    public int pollAll() {
        List<WatchPollOutcome> outcomes = sweep(null);
        long changed = outcomes.stream().filter(WatchPollOutcome::changed).count();
        log.info("🔎 Watch tick: polled={} changed={}", outcomes.size(), changed);
        return (int) changed;
    }

    /**
     * Ручной запуск по одному владельцу. Никого не уведомляет,
     * возвращает свежие ответы по всем его записям.
     */
    public List<WatchPollOutcome> pollOwner(String owner) {
        Objects.requireNonNull(owner, "owner");
        return sweep(owner);
    }

    private List<WatchPollOutcome> sweep(String owner) {
        if (!sessionReady()) {
            log.warn("🔒 Data provider session is not ready, skip watch sweep (owner={})", owner);
            return List.of();
        }

        List<JobEntity> watches = jobStore.list(JobKind.WATCH, owner);
        boolean background = owner == null;

        List<CompletableFuture<WatchPollOutcome>> futures = watches.stream()
                .map(job -> CompletableFuture.supplyAsync(() -> pollEntry(job, background), watchExecutor))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private WatchPollOutcome pollEntry(JobEntity job, boolean background) {
        String id = job.getId();
        try {
            log.debug("Processing watch: id={} owner={} itemId={} args={}",
                    id, job.getOwner(), job.getItemId(), job.getArgs());

            CommandResult result = commandExecutor.run(
                    CommandContext.of(job),
                    argsCodec.toTokens(job.getArgs()),
                    true
            );

            String reply = result == null ? null : result.replyText();
            if (reply == null) {
                log.warn("⚠️ Watch got no reply: id={} owner={}", id, job.getOwner());
                return WatchPollOutcome.failed(id, "no reply");
            }

            if (Objects.equals(job.getLastResult(), reply)) {
                log.debug("No changes for watch: id={} owner={}", id, job.getOwner());
                return WatchPollOutcome.of(id, reply, false);
            }

            log.info("🔔 Watch changed: id={} owner={} args={}", id, job.getOwner(), job.getArgs());
            jobStore.update(id, JobUpdate.builder().lastResult(reply).build());

            if (background) {
                notifyOwner(job, reply);
            }
            return WatchPollOutcome.of(id, reply, true);

        } catch (Exception e) {
            log.error("❌ Watch poll failed: id={} owner={} : {}", id, job.getOwner(), e.getMessage(), e);
            return WatchPollOutcome.failed(id, e.getMessage());
        }
    }

    private void notifyOwner(JobEntity job, String reply) {
        try {
            notificationSink.send(job.getChannelId(), JobIds.mention(job.getOwner()) + reply);
        } catch (Exception e) {
            log.warn("⚠️ Watch notification failed: id={} channel={} : {}",
                    job.getId(), job.getChannelId(), e.getMessage());
        }
    }

    private boolean sessionReady() {
        try {
            return dataProvider.ensureSession();
        } catch (Exception e) {
            log.warn("⚠️ Data provider session check failed: {}", e.getMessage());
            return false;
        }
    }
}
