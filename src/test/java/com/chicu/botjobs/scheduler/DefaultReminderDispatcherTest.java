package com.chicu.botjobs.scheduler;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.util.JobArgsCodec;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.host.CommandContext;
import com.chicu.botjobs.host.CommandExecutor;
import com.chicu.botjobs.host.CommandResult;
import com.chicu.botjobs.host.NotificationSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultReminderDispatcherTest {

    @Mock private CommandExecutor commandExecutor;
    @Mock private NotificationSink sink;

    private DefaultReminderDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DefaultReminderDispatcher(commandExecutor, sink, new JobArgsCodec(new ObjectMapper()));
    }

    private static JobEntity.JobEntityBuilder reminder() {
        return JobEntity.builder()
                .id("r1")
                .kind(JobKind.REMINDER)
                .owner("42")
                .channelId("chan");
    }

    @Test
    void dispatch_plainMessage_shouldSendMentionAndText() {
        dispatcher.dispatch(reminder().message("выпить воды").build());

        verify(sink).send("chan", "<@42> ⏰ выпить воды");
        verifyNoInteractions(commandExecutor);
    }

    @Test
    void dispatch_withArgs_shouldRunCommandInBackgroundAndSendReply() {
        when(commandExecutor.run(any(), anyList(), anyBoolean())).thenReturn(new CommandResult("BTC = 64000"));

        dispatcher.dispatch(reminder().args("[\"price BTC\"]").message("ignored").build());

        verify(commandExecutor).run(new CommandContext("chan", "42"), List.of("price", "BTC"), true);
        verify(sink).send("chan", "<@42> BTC = 64000");
    }

    @Test
    void dispatch_commandWithoutReply_shouldSendNothing() {
        when(commandExecutor.run(any(), anyList(), anyBoolean())).thenReturn(CommandResult.empty());

        dispatcher.dispatch(reminder().args("[\"sync\"]").build());

        verifyNoInteractions(sink);
    }

    @Test
    void dispatch_emptyArgsArray_shouldFallBackToMessage() {
        dispatcher.dispatch(reminder().args("").message("встреча").build());

        verify(sink).send("chan", "<@42> ⏰ встреча");
        verifyNoInteractions(commandExecutor);
    }
}
