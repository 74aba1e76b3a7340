package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

/**
 * Метрики обучения. Для неразмеченных данных accuracy/precision/recall/f1/aucRoc = null.
 */
@Builder
public record TrainingMetrics(
        Double loss,
        Double accuracy,
        Double precision,
        Double recall,
        Double f1Score,
        Double aucRoc,
        long trainingDurationMs,
        int samplesUsed
) {}
