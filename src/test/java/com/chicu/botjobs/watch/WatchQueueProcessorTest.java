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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchQueueProcessorTest {

    @Mock private JobStore jobStore;
    @Mock private CommandExecutor commandExecutor;
    @Mock private DataProvider dataProvider;

    private ExecutorService executor;
    private WatchQueueProcessor processor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        processor = new WatchQueueProcessor(
                jobStore, commandExecutor, dataProvider, new JobArgsCodec(new ObjectMapper()), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static JobEntity queued(String id, String owner, String args) {
        return JobEntity.builder().id(id).kind(JobKind.WATCH_QUEUE).owner(owner).channelId("chan").args(args).build();
    }

    private static JobEntity watch(String id, String itemId, String displayName) {
        return JobEntity.builder().id(id).kind(JobKind.WATCH).owner("u1").itemId(itemId).displayName(displayName).build();
    }

    // ==============================================================
    // QUEUE
    // ==============================================================

    @Test
    void drainQueue_shouldRunEveryEntryAsFreshCommandAndClear() {
        when(jobStore.list(JobKind.WATCH_QUEUE, null)).thenReturn(List.of(
                queued("q1", "u1", "[\"watch BTC\"]"),
                queued("q2", "u2", "[\"watch ETH\"]")
        ));
        when(jobStore.clear(JobKind.WATCH_QUEUE, null)).thenReturn(2);

        assertEquals(2, processor.drainQueue());

        verify(commandExecutor).run(new CommandContext("chan", "u1"), List.of("watch", "BTC"), false);
        verify(commandExecutor).run(new CommandContext("chan", "u2"), List.of("watch", "ETH"), false);
        verify(jobStore).clear(JobKind.WATCH_QUEUE, null);
    }

    @Test
    void drainQueue_failingEntry_shouldStillClearWholeQueue() {
        when(jobStore.list(JobKind.WATCH_QUEUE, null)).thenReturn(List.of(
                queued("q1", "u1", "[\"bad\"]"),
                queued("q2", "u2", "[\"good\"]")
        ));
        when(commandExecutor.run(any(), eq(List.of("bad")), anyBoolean())).thenThrow(new RuntimeException("nope"));

        assertEquals(2, processor.drainQueue());

        verify(commandExecutor).run(any(), eq(List.of("good")), eq(false));
        verify(jobStore).clear(JobKind.WATCH_QUEUE, null);
    }

    @Test
    void drainQueue_empty_shouldNotTouchStore() {
        when(jobStore.list(JobKind.WATCH_QUEUE, null)).thenReturn(List.of());

        assertEquals(0, processor.drainQueue());

        verify(jobStore, never()).clear(any(), any());
        verifyNoInteractions(commandExecutor);
    }

    // ==============================================================
    // NAMES
    // ==============================================================

    @Test
    void backfillNames_shouldFillOnlyNamelessEntriesWithItem() {
        when(jobStore.list(JobKind.WATCH, null)).thenReturn(List.of(
                watch("w1", "BTC", null),
                watch("w2", "ETH", "Ethereum"),
                watch("w3", null, null),
                watch("w4", "SOL", "  ")
        ));
        when(dataProvider.lookup("BTC")).thenReturn(new ItemInfo("BTC", "Bitcoin", Map.of()));
        when(dataProvider.lookup("SOL")).thenReturn(new ItemInfo("SOL", "Solana", null));
        when(jobStore.update(anyString(), any())).thenReturn(1);

        assertEquals(2, processor.backfillNames());

        ArgumentCaptor<JobUpdate> patch = ArgumentCaptor.forClass(JobUpdate.class);
        verify(jobStore).update(eq("w1"), patch.capture());
        assertEquals("Bitcoin", patch.getValue().getDisplayName());
        verify(jobStore).update(eq("w4"), any());
        verify(dataProvider, never()).lookup("ETH");
    }

    @Test
    void backfillNames_lookupFailure_shouldBeSkipped() {
        when(jobStore.list(JobKind.WATCH, null)).thenReturn(List.of(
                watch("w1", "BTC", null),
                watch("w2", "XYZ", null)
        ));
        when(dataProvider.lookup("BTC")).thenThrow(new RuntimeException("timeout"));
        when(dataProvider.lookup("XYZ")).thenReturn(null);

        assertEquals(0, processor.backfillNames());

        verify(jobStore, never()).update(anyString(), any());
    }

    @Test
    void processQueues_shouldDrainThenBackfill() {
        when(jobStore.list(JobKind.WATCH_QUEUE, null)).thenReturn(List.of());
        when(jobStore.list(JobKind.WATCH, null)).thenReturn(List.of());

        processor.processQueues();

        var order = inOrder(jobStore);
        order.verify(jobStore).list(JobKind.WATCH_QUEUE, null);
        order.verify(jobStore).list(JobKind.WATCH, null);
    }
}
