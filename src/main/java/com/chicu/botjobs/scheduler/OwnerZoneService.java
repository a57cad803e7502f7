package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.util.JobArgsCodec;
import com.chicu.botjobs.config.BotJobsProperties;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.service.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Часовой пояс для расчёта расписания:
 * пояс задачи → пояс владельца (TIMEZONE-запись) → пояс по умолчанию.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnerZoneService {

    private final JobStore jobStore;
    private final JobArgsCodec argsCodec;
    private final BotJobsProperties properties;

    public ZoneId resolve(JobEntity job) {
        return parse(job.getTimeZone())
                .or(() -> ownerZone(job.getOwner()))
                .orElseGet(this::defaultZone);
    }

    public Optional<ZoneId> ownerZone(String owner) {
        if (owner == null) return Optional.empty();

        return jobStore.get(owner)
                .filter(j -> j.getKind() == JobKind.TIMEZONE)
                .flatMap(j -> parse(j.getTimeZone()).or(() -> parse(firstArg(j))));
    }

    /**
     * Запоминает пояс владельца (одна запись на owner).
     */
    public void setOwnerZone(String owner, String channelId, String zoneId) {
        Objects.requireNonNull(owner, "owner");
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneId);
        } catch (DateTimeException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown time zone: " + zoneId, e);
        }

        JobEntity template = JobEntity.builder()
                .kind(JobKind.TIMEZONE)
                .owner(owner)
                .channelId(channelId)
                .build();

        jobStore.upsert(owner, JobUpdate.builder().timeZone(zone.getId()).build(), template);
        log.info("🌍 Owner zone set: owner={} zone={}", owner, zone);
    }

    public ZoneId defaultZone() {
        return parse(properties.getScheduler().getDefaultZone()).orElse(ZoneId.of("UTC"));
    }

    private String firstArg(JobEntity job) {
        try {
            List<String> args = argsCodec.decode(job.getArgs());
            return args.isEmpty() ? null : args.get(0);
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Bad TIMEZONE args: owner={} args={}", job.getOwner(), job.getArgs());
            return null;
        }
    }

    private Optional<ZoneId> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(ZoneId.of(raw.trim()));
        } catch (DateTimeException e) {
            log.warn("⚠️ Unknown time zone '{}', fallback", raw);
            return Optional.empty();
        }
    }
}
