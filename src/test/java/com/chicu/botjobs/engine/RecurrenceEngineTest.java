package com.chicu.botjobs.engine;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.common.enums.ScheduleKind;
import com.chicu.botjobs.config.BotJobsProperties;
import com.chicu.botjobs.domain.JobEntity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T07:00:00Z");

    private final RecurrenceEngine engine = new RecurrenceEngine(new BotJobsProperties());

    private static JobEntity reminder(Instant fireAt, boolean repeat, String rule) {
        return JobEntity.builder()
                .id("r1")
                .kind(JobKind.REMINDER)
                .owner("u1")
                .fireAt(fireAt)
                .repeat(repeat)
                .recurrenceRule(rule)
                .build();
    }

    @Test
    void firstFire_futureFireAt_shouldBeUsedAsIs() {
        Instant fireAt = NOW.plus(Duration.ofMinutes(5));

        FireSchedule s = engine.firstFire(reminder(fireAt, true, "1h"), ZoneOffset.UTC, NOW);

        assertEquals(fireAt, s.fireAt());
        assertFalse(s.isPattern());
    }

    @Test
    void firstFire_pastFireAt_shouldCatchUpToFirstInstantAfterNow() {
        Instant fireAt = NOW.minus(Duration.ofMinutes(605)); // 10ч 5мин назад

        FireSchedule s = engine.firstFire(reminder(fireAt, true, "1h"), ZoneOffset.UTC, NOW);

        // floor(605 / 60) + 1 = 11 шагов
        assertEquals(fireAt.plus(Duration.ofHours(11)), s.fireAt());
        assertTrue(s.fireAt().isAfter(NOW));
        assertFalse(s.fireAt().isAfter(NOW.plus(Duration.ofHours(1))));
    }

    @Test
    void catchUp_exactlyOnNow_shouldStepPastNow() {
        Instant fireAt = NOW.minus(Duration.ofHours(2));

        Instant next = engine.catchUp(fireAt, RecurrenceRule.parse("1h"), ZoneOffset.UTC, NOW);

        assertEquals(NOW.plus(Duration.ofHours(1)), next);
    }

    @Test
    void catchUp_yearOfMinutes_shouldConverge() {
        Instant fireAt = NOW.minus(Duration.ofDays(365)).plusSeconds(17);

        Instant next = engine.catchUp(fireAt, RecurrenceRule.parse("1m"), ZoneOffset.UTC, NOW);

        assertTrue(next.isAfter(NOW));
        assertFalse(next.isAfter(NOW.plus(Duration.ofMinutes(1))));
        assertEquals(17, next.getEpochSecond() % 60);
    }

    @Test
    void firstFire_overdueOneShot_shouldFireAfterGrace() {
        FireSchedule s = engine.firstFire(reminder(NOW.minusSeconds(30), false, null), ZoneOffset.UTC, NOW);

        assertEquals(NOW.plusSeconds(1), s.fireAt());
    }

    @Test
    void firstFire_oneShotWithoutFireAt_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.firstFire(reminder(null, false, null), ZoneOffset.UTC, NOW));
    }

    @Test
    void firstFire_repeatingWithoutFireAt_shouldStartOneStepFromNow() {
        FireSchedule s = engine.firstFire(reminder(null, true, "1d"), ZoneOffset.UTC, NOW);

        assertEquals(NOW.plus(Duration.ofDays(1)), s.fireAt());
    }

    @Test
    void firstFire_fixedPattern_shouldIgnoreStoredFireAtAndUseZone() {
        JobEntity job = reminder(Instant.parse("2000-01-01T00:00:00Z"), false, "0 9 * * *");
        job.setScheduleKind(ScheduleKind.FIXED_PATTERN);
        ZoneId moscow = ZoneId.of("Europe/Moscow");

        // NOW = 10:00 MSK → следующий 09:00 MSK завтра
        FireSchedule s = engine.firstFire(job, moscow, NOW);

        assertTrue(s.isPattern());
        assertEquals("0 0 9 * * *", s.cron());
        assertEquals(moscow, s.zone());
        assertEquals(Instant.parse("2024-05-02T06:00:00Z"), s.fireAt());
    }

    @Test
    void nextAfterFire_firedOnTime_shouldMoveOneStep() {
        FireSchedule s = engine.nextAfterFire(reminder(NOW, true, "1d"), ZoneOffset.UTC, NOW);

        assertEquals(NOW.plus(Duration.ofDays(1)), s.fireAt());
    }

    @Test
    void nextAfterFire_firedSlightlyEarly_shouldNotReuseSameInstant() {
        Instant fireAt = NOW.plusMillis(5);

        FireSchedule s = engine.nextAfterFire(reminder(fireAt, true, "1h"), ZoneOffset.UTC, NOW);

        assertEquals(fireAt.plus(Duration.ofHours(1)), s.fireAt());
    }

    @Test
    void nextAfterFire_afterLongPause_shouldBeStrictlyAfterNow() {
        Instant fireAt = NOW.minus(Duration.ofDays(3)).minusSeconds(1);

        FireSchedule s = engine.nextAfterFire(reminder(fireAt, true, "1d"), ZoneOffset.UTC, NOW);

        assertEquals(NOW.plus(Duration.ofDays(1)).minusSeconds(1), s.fireAt());
        assertTrue(s.fireAt().isAfter(NOW));
    }

    @Test
    void nextAfterFire_withoutRule_shouldFail() {
        assertThrows(IllegalStateException.class,
                () -> engine.nextAfterFire(reminder(NOW, true, null), ZoneOffset.UTC, NOW));
    }

    @Test
    void toSpringCron_shouldPrefixSecondsOnlyForFiveFields() {
        assertEquals("0 */5 * * * *", RecurrenceEngine.toSpringCron("*/5 * * * *"));
        assertEquals("30 0 9 * * MON", RecurrenceEngine.toSpringCron("30 0 9 * * MON"));
        assertThrows(IllegalArgumentException.class, () -> RecurrenceEngine.parseCron("not a cron"));
    }
}
