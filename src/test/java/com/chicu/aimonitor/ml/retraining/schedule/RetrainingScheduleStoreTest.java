package com.chicu.aimonitor.ml.retraining.schedule;

import com.chicu.aimonitor.ml.retraining.MutableClock;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;
import com.chicu.aimonitor.ml.retraining.model.ScheduleOptions;
import com.chicu.aimonitor.ml.retraining.model.ScheduleType;
import com.chicu.aimonitor.ml.retraining.model.ScheduleUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetrainingScheduleStoreTest {

    private MutableClock clock;
    private RetrainingScheduleStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:15:00Z");
        store = new RetrainingScheduleStore(clock);
    }

    @Test
    void create_interval_setsNextExecution_andDefaults() {
        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL,
                ScheduleOptions.builder().intervalMs(60_000L).build());

        assertTrue(s.getScheduleId().startsWith("schedule_" + clock.millis() + "_"));
        assertTrue(s.isEnabled());
        assertEquals(clock.instant().plusSeconds(60), s.getNextExecutionAt());
        assertEquals(RetrainingSchedule.DEFAULT_PERFORMANCE_THRESHOLD, s.getPerformanceThreshold());
        assertEquals(RetrainingSchedule.DEFAULT_DATA_VOLUME_THRESHOLD, s.getDataVolumeThreshold());
        assertNull(s.getLastExecutedAt());
    }

    @Test
    void create_interval_withoutPositiveInterval_isRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL, ScheduleOptions.none()));
        assertThrows(IllegalArgumentException.class, () ->
                store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL,
                        ScheduleOptions.builder().intervalMs(0L).build()));
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void cron_nextExecution_isTopOfNextHour_onlyWithExpression() {
        RetrainingSchedule withCron = store.create(RetrainableModelType.SIGNAL_TRACKER, ScheduleType.CRON,
                ScheduleOptions.builder().cronExpression("0 3 * * *").build());
        RetrainingSchedule withoutCron = store.create(RetrainableModelType.SIGNAL_TRACKER, ScheduleType.CRON,
                ScheduleOptions.none());

        assertEquals(Instant.parse("2026-03-01T11:00:00Z"), withCron.getNextExecutionAt());
        assertNull(withoutCron.getNextExecutionAt());
    }

    @Test
    void ids_areUniqueWithinSameMillisecond() {
        RetrainingSchedule a = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.MANUAL, null);
        RetrainingSchedule b = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.MANUAL, null);

        assertNotEquals(a.getScheduleId(), b.getScheduleId());
    }

    @Test
    void update_reportsChange_andRecomputesNextOnIntervalChange() {
        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL,
                ScheduleOptions.builder().intervalMs(60_000L).build());
        clock.advance(Duration.ofSeconds(10));

        ScheduleChange change = store.update(s.getScheduleId(),
                ScheduleUpdate.builder().intervalMs(120_000L).build()).orElseThrow();

        assertTrue(change.intervalChanged());
        assertFalse(change.enabledChanged());
        assertEquals(clock.instant().plusSeconds(120), change.after().getNextExecutionAt());
        assertEquals(clock.instant(), change.after().getUpdatedAt());
    }

    @Test
    void update_unknownSchedule_isEmpty_andInvalidIntervalRejected() {
        assertTrue(store.update("schedule_nope", ScheduleUpdate.builder().enabled(true).build()).isEmpty());

        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL,
                ScheduleOptions.builder().intervalMs(60_000L).build());
        assertThrows(IllegalArgumentException.class,
                () -> store.update(s.getScheduleId(), ScheduleUpdate.builder().intervalMs(-5L).build()));
        assertEquals(60_000L, store.get(s.getScheduleId()).orElseThrow().getIntervalMs());
    }

    @Test
    void thresholdsOutOfRange_areRejected_onCreateAndUpdate() {
        assertThrows(IllegalArgumentException.class, () -> store.create(RetrainableModelType.MARKET_PREDICTOR,
                ScheduleType.DATA_VOLUME_TRIGGER, ScheduleOptions.builder().dataVolumeThreshold(0L).build()));
        assertThrows(IllegalArgumentException.class, () -> store.create(RetrainableModelType.MARKET_PREDICTOR,
                ScheduleType.PERFORMANCE_TRIGGER, ScheduleOptions.builder().performanceThreshold(1.5).build()));
        assertTrue(store.listAll().isEmpty());

        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.DATA_VOLUME_TRIGGER,
                ScheduleOptions.builder().dataVolumeThreshold(500L).build());

        assertThrows(IllegalArgumentException.class,
                () -> store.update(s.getScheduleId(), ScheduleUpdate.builder().dataVolumeThreshold(-1L).build()));
        assertThrows(IllegalArgumentException.class,
                () -> store.update(s.getScheduleId(), ScheduleUpdate.builder()
                        .enabled(false)
                        .performanceThreshold(-0.1)
                        .build()));

        RetrainingSchedule after = store.get(s.getScheduleId()).orElseThrow();
        assertEquals(500L, after.getDataVolumeThreshold());
        assertTrue(after.isEnabled());
    }

    @Test
    void returnedSchedules_areCopies() {
        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.MANUAL, null);
        s.setEnabled(false);

        assertTrue(store.get(s.getScheduleId()).orElseThrow().isEnabled());
        assertEquals(1, store.countEnabled());
    }

    @Test
    void markExecuted_andDelete() {
        RetrainingSchedule s = store.create(RetrainableModelType.MARKET_PREDICTOR, ScheduleType.INTERVAL,
                ScheduleOptions.builder().intervalMs(60_000L).build());
        clock.advance(Duration.ofMinutes(1));

        RetrainingSchedule executed = store.markExecuted(s.getScheduleId()).orElseThrow();
        assertEquals(clock.instant(), executed.getLastExecutedAt());
        assertEquals(clock.instant().plusSeconds(60), executed.getNextExecutionAt());

        assertTrue(store.delete(s.getScheduleId()).isPresent());
        assertTrue(store.delete(s.getScheduleId()).isEmpty());
        assertTrue(store.markExecuted(s.getScheduleId()).isEmpty());
    }
}
