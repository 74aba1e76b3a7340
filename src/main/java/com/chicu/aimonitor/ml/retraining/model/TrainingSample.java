package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Один обучающий пример: вектор поведенческих признаков кошелька.
 * label == null: неразмеченный пример.
 */
@Builder
public record TrainingSample(
        String id,
        String walletAddress,
        Map<String, Double> features,
        Boolean label,
        Instant timestamp
) {
    public boolean isLabeled() {
        return label != null;
    }
}
