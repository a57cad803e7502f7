package com.chicu.botjobs.smoke;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.domain.JobEntity;
import com.chicu.botjobs.engine.TimerTable;
import com.chicu.botjobs.host.NotificationSink;
import com.chicu.botjobs.service.JobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Полный цикл: запись в БД → таймер → уведомление → удаление/перенос.
 */
@SpringBootTest
class ReminderLifecycleSmokeTest {

    @Autowired private JobStore jobStore;
    @Autowired private TimerTable timers;

    @MockBean private NotificationSink sink;

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + timeout);
            }
            Thread.sleep(50);
        }
    }

    @Test
    void oneShotReminder_shouldFireOnceAndDisappear() throws Exception {
        String id = jobStore.insert(JobEntity.builder()
                .kind(JobKind.REMINDER)
                .owner("smoke-1")
                .channelId("chan-1")
                .message("стендап")
                .fireAt(Instant.now().truncatedTo(ChronoUnit.MILLIS).plusSeconds(1))
                .build());

        assertTrue(timers.isArmed(id), "таймер взводится сразу после вставки");

        verify(sink, timeout(5000)).send("chan-1", "<@smoke-1> ⏰ стендап");
        waitUntil(() -> jobStore.get(id).isEmpty(), Duration.ofSeconds(5));
        waitUntil(() -> !timers.isArmed(id), Duration.ofSeconds(5));
    }

    @Test
    void repeatingReminder_shouldBeRescheduledAndStayArmed() throws Exception {
        Instant firstFire = Instant.now().truncatedTo(ChronoUnit.MILLIS).plusSeconds(1);
        String id = jobStore.insert(JobEntity.builder()
                .kind(JobKind.REMINDER)
                .owner("smoke-2")
                .channelId("chan-2")
                .message("пить воду")
                .fireAt(firstFire)
                .repeat(true)
                .recurrenceRule("1h")
                .build());

        verify(sink, timeout(5000)).send(eq("chan-2"), contains("пить воду"));

        Instant expected = firstFire.plus(Duration.ofHours(1));
        waitUntil(() -> jobStore.get(id)
                .map(j -> expected.equals(j.getFireAt()))
                .orElse(false), Duration.ofSeconds(5));
        waitUntil(() -> timers.isArmed(id), Duration.ofSeconds(5));

        assertEquals(1, jobStore.clear(JobKind.REMINDER, "smoke-2"));
        assertFalse(timers.isArmed(id));
        assertTrue(jobStore.get(id).isEmpty());
    }
}
