package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

/**
 * Параметры при создании расписания. enabled == null трактуется как true.
 */
@Builder
public record ScheduleOptions(
        Long intervalMs,
        String cronExpression,
        Double performanceThreshold,
        Long dataVolumeThreshold,
        Boolean enabled
) {
    public static ScheduleOptions none() {
        return ScheduleOptions.builder().build();
    }
}
