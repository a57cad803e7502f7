package com.chicu.botjobs.web.dto;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.enums.ScheduleKind;
import com.chicu.botjobs.domain.JobEntity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Отсутствующие поля в JSON не выводятся (не путаем с пустыми).
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobDto {

    private String id;
    private JobKind kind;
    private String owner;
    private String channelId;
    private String args;
    private String message;
    private String itemId;
    private String displayName;
    private String lastResult;
    private Instant createdAt;
    private Instant fireAt;
    private boolean repeat;
    private String recurrenceRule;
    private ScheduleKind scheduleKind;
    private String timeZone;
    private boolean armed;

    public static JobDto from(JobEntity e, boolean armed) {
        return JobDto.builder()
                .id(e.getId())
                .kind(e.getKind())
                .owner(e.getOwner())
                .channelId(e.getChannelId())
                .args(e.getArgs())
                .message(e.getMessage())
                .itemId(e.getItemId())
                .displayName(e.getDisplayName())
                .lastResult(e.getLastResult())
                .createdAt(e.getCreatedAt())
                .fireAt(e.getFireAt())
                .repeat(e.isRepeat())
                .recurrenceRule(e.getRecurrenceRule())
                .scheduleKind(e.getScheduleKind())
                .timeZone(e.getTimeZone())
                .armed(armed)
                .build();
    }
}
