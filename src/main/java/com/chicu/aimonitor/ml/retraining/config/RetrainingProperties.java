package com.chicu.aimonitor.ml.retraining.config;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.ValidationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.retraining")
public class RetrainingProperties {

    private boolean enabled = true;

    /** Потолок одновременно активных (не терминальных) задач */
    private int maxConcurrentJobs = 2;

    private boolean autoPerformanceRetraining = true;

    /** 0.1 = падение точности на 10% от baseline */
    private double performanceDropThreshold = 0.1;

    /** Минимальная пауза между переобучениями одной модели (по таймеру / perf-триггеру) */
    private long minRetrainingIntervalMs = 24L * 60 * 60 * 1000;

    private boolean cacheEnabled = true;
    private long cacheTtlMs = 5L * 60 * 1000;

    /**
     * Частичные дефолты шедулера: незаданные поля берутся из зашитых дефолтов политик.
     */
    private DataCollectionPolicy defaultDataCollection;
    private ValidationPolicy defaultValidation;
    private DeploymentPolicy defaultDeployment;

    private Simulation simulation = new Simulation();

    @Data
    public static class Simulation {
        /** Seed для симуляций (обучение, валидация, синтетические данные) */
        private long seed = 42L;

        /** Вероятность успешного health check после деплоя */
        private double deploymentSuccessRate = 0.95;
    }

    public SchedulerSettings toSettings() {
        SchedulerSettings compiled = SchedulerSettings.defaults();
        return compiled.toBuilder()
                .enabled(enabled)
                .maxConcurrentJobs(maxConcurrentJobs)
                .autoPerformanceRetraining(autoPerformanceRetraining)
                .performanceDropThreshold(performanceDropThreshold)
                .minRetrainingIntervalMs(minRetrainingIntervalMs)
                .cacheEnabled(cacheEnabled)
                .cacheTtlMs(cacheTtlMs)
                .defaultDataCollection(compiled.defaultDataCollection().mergedWith(defaultDataCollection))
                .defaultValidation(compiled.defaultValidation().mergedWith(defaultValidation))
                .defaultDeployment(compiled.defaultDeployment().mergedWith(defaultDeployment))
                .build();
    }
}
