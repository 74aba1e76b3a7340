package com.chicu.aimonitor.ml.retraining.training;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingMetrics;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Заглушка обучения: метрики из правдоподобных диапазонов, F1 считается из precision/recall.
 * Без размеченных примеров метрики качества = null.
 */
@Slf4j
public class SimulatedModelTrainer implements ModelTrainer {

    private final Random random;
    private final AtomicLong seq = new AtomicLong();

    public SimulatedModelTrainer(Random random) {
        this.random = random;
    }

    @Override
    public TrainedModel train(RetrainableModelType modelType, List<TrainingSample> samples) {
        log.warn("🧪 ModelTrainer = SIMULATED (type={}, samples={}), подключи реальный ModelTrainer",
                modelType, samples.size());

        boolean labeled = samples.stream().anyMatch(TrainingSample::isLabeled);

        double accuracy = 0.75 + random.nextDouble() * 0.2;
        double precision = 0.7 + random.nextDouble() * 0.25;
        double recall = 0.65 + random.nextDouble() * 0.3;
        double f1 = 2 * precision * recall / (precision + recall);
        double aucRoc = 0.8 + random.nextDouble() * 0.15;

        TrainingMetrics metrics = TrainingMetrics.builder()
                .loss(0.1 + random.nextDouble() * 0.1)
                .accuracy(labeled ? accuracy : null)
                .precision(labeled ? precision : null)
                .recall(labeled ? recall : null)
                .f1Score(labeled ? f1 : null)
                .aucRoc(labeled ? aucRoc : null)
                .trainingDurationMs(1000 + (long) (random.nextDouble() * 5000))
                .samplesUsed(samples.size())
                .build();

        String modelId = "model_" + modelType.name().toLowerCase() + "_" + System.currentTimeMillis() + "_" + seq.incrementAndGet();
        return new TrainedModel(modelId, metrics);
    }
}
