package com.chicu.aimonitor.ml.retraining.training;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Стадия обучения: зарегистрированный ModelTrainer или симуляция.
 * Гарантирует, что новый modelId непустой и отличается от предыдущего.
 */
@Slf4j
public class TrainingStage {

    private final ModelTrainer fallback;
    private volatile ModelTrainer trainer;

    public TrainingStage(ModelTrainer trainer, ModelTrainer fallback) {
        this.trainer = trainer;
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public void setTrainer(ModelTrainer trainer) {
        this.trainer = trainer;
    }

    public boolean hasTrainer() {
        return trainer != null;
    }

    public TrainedModel train(RetrainableModelType type, List<TrainingSample> samples, String previousModelId) {
        ModelTrainer t = trainer != null ? trainer : fallback;

        long started = System.currentTimeMillis();
        TrainedModel model = t.train(type, samples);

        if (model == null || model.modelId() == null || model.modelId().isBlank()) {
            throw new IllegalStateException("Trainer returned no model id");
        }
        if (model.modelId().equals(previousModelId)) {
            throw new IllegalStateException("Trainer returned the deployed model id again: " + previousModelId);
        }
        if (model.metrics() == null) {
            throw new IllegalStateException("Trainer returned no metrics for " + model.modelId());
        }

        log.info("🧠 TRAIN OK type={} modelId={} samples={} accuracy={} tookMs={}",
                type, model.modelId(), model.metrics().samplesUsed(), model.metrics().accuracy(),
                System.currentTimeMillis() - started);
        return model;
    }
}
