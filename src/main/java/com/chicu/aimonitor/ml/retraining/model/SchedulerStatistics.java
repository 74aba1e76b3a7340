package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record SchedulerStatistics(
        int totalJobs,
        int successfulJobs,
        int failedJobs,
        int rolledBackJobs,
        int cancelledJobs,
        double avgTrainingDurationMs,
        double avgImprovementPercent,
        long totalSamplesUsed,
        int activeSchedules,
        Map<RetrainableModelType, Integer> jobsByModelType,
        Map<TriggerReason, Integer> jobsByTriggerReason,
        Instant lastUpdated
) {}
