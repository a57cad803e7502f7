package com.chicu.botjobs.host;

import com.chicu.botjobs.domain.JobEntity;

/**
 * Синтетический контекст сообщения: куда отвечать и от чьего имени.
 * Живой сессии транспорта за ним нет.
 */
public record CommandContext(String channelId, String owner) {

    public static CommandContext of(JobEntity job) {
        return new CommandContext(job.getChannelId(), job.getOwner());
    }
}
