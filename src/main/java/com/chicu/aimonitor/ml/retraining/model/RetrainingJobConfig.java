package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.util.List;

/**
 * Замороженная конфигурация задачи: политики уже слиты из всех слоёв.
 */
@Builder
public record RetrainingJobConfig(
        RetrainableModelType modelType,
        DataCollectionPolicy dataCollection,
        ValidationPolicy validation,
        DeploymentPolicy deployment,
        TriggerReason triggerReason,
        String scheduleId,
        int priority,
        List<String> tags
) {
    public RetrainingJobConfig {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
