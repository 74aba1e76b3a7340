package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.util.List;

/**
 * Параметры конкретного вызова triggerRetraining, самый верхний слой слияния.
 */
@Builder
public record RetrainingOptions(
        String scheduleId,
        Integer priority,
        DataCollectionPolicy dataCollection,
        ValidationPolicy validation,
        DeploymentPolicy deployment,
        List<String> tags
) {
    public static final int DEFAULT_PRIORITY = 1;

    public static RetrainingOptions none() {
        return RetrainingOptions.builder().build();
    }
}
