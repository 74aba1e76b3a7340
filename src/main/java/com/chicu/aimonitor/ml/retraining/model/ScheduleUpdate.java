package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

/**
 * Частичное обновление расписания: null-поля не трогаем.
 */
@Builder
public record ScheduleUpdate(
        Boolean enabled,
        Long intervalMs,
        String cronExpression,
        Double performanceThreshold,
        Long dataVolumeThreshold
) {}
