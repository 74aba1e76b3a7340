package com.chicu.aimonitor.ml.retraining.training;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;

import java.util.List;

/**
 * Непрозрачный бэкенд обучения: samples -> {modelId, metrics}.
 */
public interface ModelTrainer {

    TrainedModel train(RetrainableModelType modelType, List<TrainingSample> samples);
}
