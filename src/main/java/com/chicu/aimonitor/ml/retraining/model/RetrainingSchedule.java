package com.chicu.aimonitor.ml.retraining.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Правило, порождающее триггеры переобучения.
 * Хранится только в RetrainingScheduleStore; таймеры держат лишь scheduleId.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrainingSchedule {

    public static final double DEFAULT_PERFORMANCE_THRESHOLD = 0.1;
    public static final long DEFAULT_DATA_VOLUME_THRESHOLD = 1000;

    private String scheduleId;
    private RetrainableModelType modelType;
    private ScheduleType scheduleType;

    /** Для INTERVAL */
    private Long intervalMs;
    /** Для CRON (пока без полноценного парсера) */
    private String cronExpression;
    /** Для PERFORMANCE_TRIGGER */
    private Double performanceThreshold;
    /** Для DATA_VOLUME_TRIGGER */
    private Long dataVolumeThreshold;

    private boolean enabled;

    private Instant lastExecutedAt;
    private Instant nextExecutionAt;
    private Instant createdAt;
    private Instant updatedAt;

    public RetrainingSchedule copy() {
        return toBuilder().build();
    }
}
