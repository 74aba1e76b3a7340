package com.chicu.aimonitor.ml.retraining.config;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import lombok.Builder;

/**
 * Глобальные ручки оркестратора на время жизни процесса.
 * null-поле в частичном апдейте = "не менять".
 */
@Builder(toBuilder = true)
public record SchedulerSettings(
        Integer maxConcurrentJobs,
        DataCollectionPolicy defaultDataCollection,
        ValidationPolicy defaultValidation,
        DeploymentPolicy defaultDeployment,
        Boolean autoPerformanceRetraining,
        Double performanceDropThreshold,
        Long minRetrainingIntervalMs,
        Boolean enabled,
        Boolean cacheEnabled,
        Long cacheTtlMs
) {

    public static SchedulerSettings defaults() {
        return SchedulerSettings.builder()
                .maxConcurrentJobs(2)
                .defaultDataCollection(DataCollectionPolicy.defaults())
                .defaultValidation(ValidationPolicy.defaults())
                .defaultDeployment(DeploymentPolicy.defaults())
                .autoPerformanceRetraining(true)
                .performanceDropThreshold(0.1)
                .minRetrainingIntervalMs(24L * 60 * 60 * 1000)
                .enabled(true)
                .cacheEnabled(true)
                .cacheTtlMs(5L * 60 * 1000)
                .build();
    }

    public SchedulerSettings mergedWith(SchedulerSettings patch) {
        if (patch == null) return this;
        return new SchedulerSettings(
                pick(patch.maxConcurrentJobs(), maxConcurrentJobs),
                pick(patch.defaultDataCollection(), defaultDataCollection),
                pick(patch.defaultValidation(), defaultValidation),
                pick(patch.defaultDeployment(), defaultDeployment),
                pick(patch.autoPerformanceRetraining(), autoPerformanceRetraining),
                pick(patch.performanceDropThreshold(), performanceDropThreshold),
                pick(patch.minRetrainingIntervalMs(), minRetrainingIntervalMs),
                pick(patch.enabled(), enabled),
                pick(patch.cacheEnabled(), cacheEnabled),
                pick(patch.cacheTtlMs(), cacheTtlMs)
        );
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isCacheEnabled() {
        return Boolean.TRUE.equals(cacheEnabled);
    }

    public boolean isAutoPerformanceRetraining() {
        return Boolean.TRUE.equals(autoPerformanceRetraining);
    }

    private static <T> T pick(T patch, T base) {
        return patch != null ? patch : base;
    }
}
