package com.chicu.aimonitor.ml.retraining.schedule;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.RetrainingSchedule;
import com.chicu.aimonitor.ml.retraining.model.ScheduleOptions;
import com.chicu.aimonitor.ml.retraining.model.ScheduleType;
import com.chicu.aimonitor.ml.retraining.model.ScheduleUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory реестр расписаний.
 *
 * Единственный владелец {@link RetrainingSchedule}; наружу уходят только копии.
 * Таймерами не управляет: это делает оркестратор по {@link ScheduleChange}.
 */
@Slf4j
@Component
public class RetrainingScheduleStore {

    private final Clock clock;
    private final AtomicLong seq = new AtomicLong();

    /** scheduleId -> schedule, в порядке создания */
    private final Map<String, RetrainingSchedule> schedules = new LinkedHashMap<>();

    public RetrainingScheduleStore(Clock clock) {
        this.clock = clock;
    }

    public synchronized RetrainingSchedule create(RetrainableModelType modelType,
                                                  ScheduleType scheduleType,
                                                  ScheduleOptions options) {
        if (modelType == null) throw new IllegalArgumentException("modelType=null");
        if (scheduleType == null) throw new IllegalArgumentException("scheduleType=null");

        ScheduleOptions o = options != null ? options : ScheduleOptions.none();
        if (scheduleType == ScheduleType.INTERVAL) {
            requirePositiveInterval(o.intervalMs());
        }
        requireValidThresholds(o.performanceThreshold(), o.dataVolumeThreshold());

        Instant now = clock.instant();

        RetrainingSchedule s = RetrainingSchedule.builder()
                .scheduleId("schedule_" + now.toEpochMilli() + "_" + seq.incrementAndGet())
                .modelType(modelType)
                .scheduleType(scheduleType)
                .intervalMs(o.intervalMs())
                .cronExpression(o.cronExpression())
                .performanceThreshold(o.performanceThreshold() != null
                        ? o.performanceThreshold()
                        : RetrainingSchedule.DEFAULT_PERFORMANCE_THRESHOLD)
                .dataVolumeThreshold(o.dataVolumeThreshold() != null
                        ? o.dataVolumeThreshold()
                        : RetrainingSchedule.DEFAULT_DATA_VOLUME_THRESHOLD)
                .enabled(o.enabled() == null || o.enabled())
                .createdAt(now)
                .updatedAt(now)
                .build();

        s.setNextExecutionAt(nextExecution(s, now));

        schedules.put(s.getScheduleId(), s);
        log.info("🗓 Schedule created id={} type={} kind={} enabled={} next={}",
                s.getScheduleId(), modelType, scheduleType, s.isEnabled(), s.getNextExecutionAt());
        return s.copy();
    }

    public synchronized Optional<ScheduleChange> update(String scheduleId, ScheduleUpdate patch) {
        RetrainingSchedule s = schedules.get(scheduleId);
        if (s == null) return Optional.empty();

        RetrainingSchedule before = s.copy();
        if (patch != null) {
            requireValidThresholds(patch.performanceThreshold(), patch.dataVolumeThreshold());
            if (patch.intervalMs() != null) {
                requirePositiveInterval(patch.intervalMs());
                s.setIntervalMs(patch.intervalMs());
            }
            if (patch.cronExpression() != null) s.setCronExpression(patch.cronExpression());
            if (patch.performanceThreshold() != null) s.setPerformanceThreshold(patch.performanceThreshold());
            if (patch.dataVolumeThreshold() != null) s.setDataVolumeThreshold(patch.dataVolumeThreshold());
            if (patch.enabled() != null) s.setEnabled(patch.enabled());
        }

        Instant now = clock.instant();
        s.setUpdatedAt(now);

        ScheduleChange change = new ScheduleChange(before, s.copy());
        if (change.intervalChanged() || (change.enabledChanged() && s.isEnabled())) {
            s.setNextExecutionAt(nextExecution(s, now));
        }

        log.info("🗓 Schedule updated id={} enabled={} intervalMs={}", scheduleId, s.isEnabled(), s.getIntervalMs());
        return Optional.of(new ScheduleChange(before, s.copy()));
    }

    /**
     * Отметка срабатывания таймера.
     */
    public synchronized Optional<RetrainingSchedule> markExecuted(String scheduleId) {
        RetrainingSchedule s = schedules.get(scheduleId);
        if (s == null) return Optional.empty();

        Instant now = clock.instant();
        s.setLastExecutedAt(now);
        s.setNextExecutionAt(nextExecution(s, now));
        s.setUpdatedAt(now);
        return Optional.of(s.copy());
    }

    public synchronized Optional<RetrainingSchedule> delete(String scheduleId) {
        RetrainingSchedule removed = schedules.remove(scheduleId);
        if (removed != null) {
            log.info("🗑 Schedule deleted id={}", scheduleId);
        }
        return Optional.ofNullable(removed).map(RetrainingSchedule::copy);
    }

    public synchronized Optional<RetrainingSchedule> get(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId)).map(RetrainingSchedule::copy);
    }

    public synchronized List<RetrainingSchedule> listAll() {
        return schedules.values().stream().map(RetrainingSchedule::copy).toList();
    }

    public synchronized List<RetrainingSchedule> listForModel(RetrainableModelType modelType) {
        return schedules.values().stream()
                .filter(s -> s.getModelType() == modelType)
                .map(RetrainingSchedule::copy)
                .toList();
    }

    public synchronized int countEnabled() {
        return (int) schedules.values().stream().filter(RetrainingSchedule::isEnabled).count();
    }

    public synchronized void clear() {
        schedules.clear();
    }

    // ==== nextExecutionAt ====

    private static Instant nextExecution(RetrainingSchedule s, Instant now) {
        switch (s.getScheduleType()) {
            case INTERVAL:
                return now.plus(Duration.ofMillis(s.getIntervalMs()));
            case CRON:
                if (s.getCronExpression() == null || s.getCronExpression().isBlank()) return null;
                // без разбора выражения: ближайший целый час
                return now.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS);
            default:
                return null;
        }
    }

    private static void requirePositiveInterval(Long intervalMs) {
        if (intervalMs == null || intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0 for INTERVAL schedule");
        }
    }

    // null = "не задано", проверяем только переданные значения
    private static void requireValidThresholds(Double performanceThreshold, Long dataVolumeThreshold) {
        if (performanceThreshold != null && (performanceThreshold < 0.0 || performanceThreshold > 1.0)) {
            throw new IllegalArgumentException("performanceThreshold must be within [0..1], got " + performanceThreshold);
        }
        if (dataVolumeThreshold != null && dataVolumeThreshold <= 0) {
            throw new IllegalArgumentException("dataVolumeThreshold must be > 0, got " + dataVolumeThreshold);
        }
    }
}
