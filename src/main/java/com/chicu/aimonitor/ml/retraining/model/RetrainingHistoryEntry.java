package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Денормализованная запись о завершённой задаче. Только append, никогда не меняется.
 * newAccuracy / improvement заполнены только для COMPLETED.
 */
@Builder
public record RetrainingHistoryEntry(
        String entryId,
        String jobId,
        RetrainableModelType modelType,
        TriggerReason triggerReason,
        RetrainingJobStatus status,
        double previousAccuracy,
        Double newAccuracy,
        Double improvement,
        int trainingSamples,
        long durationMs,
        Instant timestamp,
        String notes
) {}
