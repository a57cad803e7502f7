package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.common.util.JobArgsCodec;
import com.chicu.botjobs.common.util.JobIds;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.host.CommandContext;
import com.chicu.botjobs.host.CommandExecutor;
import com.chicu.botjobs.host.CommandResult;
import com.chicu.botjobs.host.NotificationSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * С аргументами — выполняет команду и шлёт её ответ.
 * Без аргументов — шлёт текст напоминания.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultReminderDispatcher implements ReminderDispatcher {

    private final CommandExecutor commandExecutor;
    private final NotificationSink notificationSink;
    private final JobArgsCodec argsCodec;

    @Override
    public void dispatch(JobEntity reminder) {
        String mention = JobIds.mention(reminder.getOwner());

        if (reminder.getArgs() != null && !reminder.getArgs().isEmpty()) {
            CommandResult result = commandExecutor.run(
                    CommandContext.of(reminder),
                    argsCodec.toTokens(reminder.getArgs()),
                    true
            );
            if (result == null || !result.hasReply()) {
                log.debug("Reminder command gave no reply: id={}", reminder.getId());
                return;
            }
            notificationSink.send(reminder.getChannelId(), mention + " " + result.replyText());
            return;
        }

        String text = reminder.getMessage() == null ? "" : reminder.getMessage();
        notificationSink.send(reminder.getChannelId(), mention + " ⏰ " + text);
        log.info("⏰ Reminder sent: id={} owner={} channel={}",
                reminder.getId(), reminder.getOwner(), reminder.getChannelId());
    }
}
