package com.chicu.botjobs.domain;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.enums.ScheduleKind;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Единственная хранимая сущность: отложенная или повторяющаяся задача бота.
 *
 * Необязательные поля хранятся как NULL, если их нет.
 * Пустая строка — это "поле есть, но пустое", её не путаем с NULL.
 */
@Entity
@DynamicUpdate
@Table(
        name = "jobs",
        indexes = {
                @Index(name = "ix_jobs_kind_owner", columnList = "kind,owner_id"),
                @Index(name = "ix_jobs_created_at", columnList = "created_at")
        }
)
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(exclude = "lastResult")
public class JobEntity {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private JobKind kind;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String owner;

    @Column(name = "channel_id", length = 64)
    private String channelId;

    /** JSON-массив строк, см. JobArgsCodec */
    @Column(name = "args", length = 4000)
    private String args;

    @Column(name = "message", length = 2000)
    private String message;

    @Column(name = "item_id", length = 128)
    private String itemId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "fire_at")
    private Instant fireAt;

    @Builder.Default
    @Column(name = "repeat_flag", nullable = false)
    private boolean repeat = false;

    /** "1d", "2h 30m" для ABSOLUTE; cron для FIXED_PATTERN */
    @Column(name = "recurrence_rule", length = 128)
    private String recurrenceRule;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_kind", nullable = false, length = 16)
    private ScheduleKind scheduleKind = ScheduleKind.ABSOLUTE;

    @Column(name = "time_zone", length = 64)
    private String timeZone;

    @Column(name = "last_result", length = 10000)
    private String lastResult;

    @Column(name = "display_name", length = 256)
    private String displayName;

    public boolean isFixedPattern() {
        return scheduleKind == ScheduleKind.FIXED_PATTERN;
    }
}
