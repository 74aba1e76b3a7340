package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ValidationResult(
        ValidationStrategy strategy,
        boolean passed,
        double oldModelAccuracy,
        double newModelAccuracy,
        double improvement,
        double improvementPercent,
        int samplesUsed,
        Metrics metrics,
        Instant validatedAt,
        String failureReason
) {

    @Builder
    public record Metrics(
            double precision,
            double recall,
            double f1Score,
            double aucRoc
    ) {}
}
