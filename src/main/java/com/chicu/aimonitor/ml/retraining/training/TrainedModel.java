package com.chicu.aimonitor.ml.retraining.training;

import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;

public record TrainedModel(
        String modelId,
        TrainingMetrics metrics
) {}
