package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import static com.chicu.aimonitor.ml.retraining.model.PolicyMerge.pick;

/**
 * Пороги качества, которые новая модель обязана пройти до деплоя.
 * maxDegradation: отрицательная граница (например -0.05).
 */
@Builder(toBuilder = true)
public record ValidationPolicy(
        ValidationStrategy strategy,
        Double minAccuracy,
        Double minImprovement,
        Double maxDegradation,
        Double holdoutSize,
        Integer validationSamples,
        Long abTestDurationMs,
        Integer abTestTrafficPercent
) {

    public static ValidationPolicy defaults() {
        return ValidationPolicy.builder()
                .strategy(ValidationStrategy.HOLDOUT_VALIDATION)
                .minAccuracy(0.7)
                .minImprovement(0.0)
                .maxDegradation(-0.05)
                .holdoutSize(0.2)
                .validationSamples(1000)
                .abTestDurationMs(24L * 60 * 60 * 1000)
                .abTestTrafficPercent(10)
                .build();
    }

    public ValidationPolicy mergedWith(ValidationPolicy override) {
        if (override == null) return this;
        return new ValidationPolicy(
                pick(override.strategy(), strategy),
                pick(override.minAccuracy(), minAccuracy),
                pick(override.minImprovement(), minImprovement),
                pick(override.maxDegradation(), maxDegradation),
                pick(override.holdoutSize(), holdoutSize),
                pick(override.validationSamples(), validationSamples),
                pick(override.abTestDurationMs(), abTestDurationMs),
                pick(override.abTestTrafficPercent(), abTestTrafficPercent)
        );
    }
}
