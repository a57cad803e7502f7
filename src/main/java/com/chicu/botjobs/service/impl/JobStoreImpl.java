package com.chicu.botjobs.service.impl;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.enums.ScheduleKind;
import com.chicu.botjobs.common.util.JobIds;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.engine.RecurrenceEngine;
import com.chicu.botjobs.engine.RecurrenceRule;
import com.chicu.botjobs.repository.JobRepository;
import com.chicu.botjobs.scheduler.ReminderScheduler;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.service.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobStoreImpl implements JobStore {

    private final JobRepository repository;
    private final ObjectProvider<ReminderScheduler> schedulerProvider;
    private final Clock clock;

    // ==============================================================
    // INSERT
    // ==============================================================
    @Override
    @Transactional
    public String insert(JobEntity job) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(job.getKind(), "kind");
        Objects.requireNonNull(job.getOwner(), "owner");

        if (job.getScheduleKind() == null) {
            job.setScheduleKind(ScheduleKind.ABSOLUTE);
        }
        validate(job);

        if (job.getKind() == JobKind.TIMEZONE) {
            job.setId(job.getOwner());
        } else if (job.getId() == null || job.getId().isBlank()) {
            job.setId(JobIds.newId());
        }
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(clock.instant());
        }

        // save() с готовым id делает merge — без проверки чужая запись перезаписалась бы
        if (repository.existsById(job.getId())) {
            throw new IllegalArgumentException("Job already exists: id=" + job.getId());
        }

        JobEntity saved = repository.save(job);
        log.info("💾 Job stored: id={} kind={} owner={} fireAt={} repeat={}",
                saved.getId(), saved.getKind(), saved.getOwner(), saved.getFireAt(), saved.isRepeat());

        if (saved.getKind() == JobKind.REMINDER) {
            afterCommit(() -> schedulerProvider.getObject().load(saved));
        }
        return saved.getId();
    }

    // ==============================================================
    // READ
    // ==============================================================
    @Override
    @Transactional(readOnly = true)
    public Optional<JobEntity> get(String id) {
        if (id == null) return Optional.empty();
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobEntity> list(JobKind kind, String owner) {
        Objects.requireNonNull(kind, "kind");
        if (owner == null) {
            return repository.findByKindOrderByCreatedAtAscIdAsc(kind);
        }
        return repository.findByKindAndOwnerOrderByCreatedAtAscIdAsc(kind, owner);
    }

    // ==============================================================
    // UPDATE
    // ==============================================================
    @Override
    @Transactional
    public int update(String id, JobUpdate patch) {
        Objects.requireNonNull(patch, "patch");
        if (id == null) return 0;

        Optional<JobEntity> existing = repository.findById(id);
        if (existing.isEmpty()) {
            log.debug("Job update skipped, not found: id={}", id);
            return 0;
        }

        JobEntity job = existing.get();
        patch.applyTo(job);
        repository.save(job);
        return 1;
    }

    @Override
    @Transactional
    public int upsert(String id, JobUpdate patch, JobEntity template) {
        Objects.requireNonNull(template, "template");
        if (update(id, patch) > 0) return 1;

        JobEntity fresh = template.toBuilder().id(id).build();
        patch.applyTo(fresh);
        insert(fresh);
        return 1;
    }

    // ==============================================================
    // DELETE
    // ==============================================================
    @Override
    @Transactional
    public int remove(String id) {
        if (id == null) return 0;
        return repository.deleteJobById(id);
    }

    @Override
    @Transactional
    public int clear(JobKind kind, String owner) {
        Objects.requireNonNull(kind, "kind");

        if (kind == JobKind.REMINDER) {
            ReminderScheduler scheduler = schedulerProvider.getObject();
            list(kind, owner).forEach(job -> scheduler.cancel(job.getId()));
        }

        int deleted = owner == null
                ? repository.deleteAllByKind(kind)
                : repository.deleteAllByKindAndOwner(kind, owner);

        log.info("🧹 Jobs cleared: kind={} owner={} deleted={}", kind, owner, deleted);
        return deleted;
    }

    // ==============================================================
    // VALIDATION
    // ==============================================================
    private void validate(JobEntity job) {
        String rule = job.getRecurrenceRule();
        boolean hasRule = rule != null && !rule.isBlank();

        if (job.isRepeat() && !hasRule) {
            throw new IllegalArgumentException("repeat=true requires recurrenceRule");
        }

        ZoneId zone = ZoneOffset.UTC;
        if (job.getTimeZone() != null && !job.getTimeZone().isBlank()) {
            try {
                zone = ZoneId.of(job.getTimeZone());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unknown time zone: " + job.getTimeZone(), e);
            }
        }

        Instant now = clock.instant();

        if (job.isFixedPattern()) {
            if (!hasRule) {
                throw new IllegalArgumentException("FIXED_PATTERN requires a cron recurrenceRule");
            }
            if (RecurrenceEngine.parseCron(rule).next(now.atZone(zone)) == null) {
                throw new IllegalArgumentException("Cron pattern never fires: '" + rule + "'");
            }
        } else if (hasRule) {
            RecurrenceRule parsed = RecurrenceRule.parse(rule);
            try {
                parsed.applyTo(now, zone);
            } catch (DateTimeException | ArithmeticException | IllegalStateException e) {
                throw new IllegalArgumentException("Recurrence rule out of range: '" + rule + "'", e);
            }
        }
    }

    /**
     * Таймер взводится только когда запись уже видна другим потокам.
     */
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
