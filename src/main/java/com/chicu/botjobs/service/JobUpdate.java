package com.chicu.botjobs.service;

import com.chicu.botjobs.domain.JobEntity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Частичное обновление задачи: пишутся только не-null поля.
 */
@Getter
@Builder
@ToString(exclude = "lastResult")
public class JobUpdate {

    private final Instant fireAt;
    private final String lastResult;
    private final String displayName;
    private final String channelId;
    private final String message;
    private final String args;
    private final String timeZone;

    public boolean isEmpty() {
        return fireAt == null
                && lastResult == null
                && displayName == null
                && channelId == null
                && message == null
                && args == null
                && timeZone == null;
    }

    public void applyTo(JobEntity job) {
        if (fireAt != null) job.setFireAt(fireAt);
        if (lastResult != null) job.setLastResult(lastResult);
        if (displayName != null) job.setDisplayName(displayName);
        if (channelId != null) job.setChannelId(channelId);
        if (message != null) job.setMessage(message);
        if (args != null) job.setArgs(args);
        if (timeZone != null) job.setTimeZone(timeZone);
    }
}
