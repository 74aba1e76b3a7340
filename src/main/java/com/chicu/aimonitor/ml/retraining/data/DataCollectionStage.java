package com.chicu.aimonitor.ml.retraining.data;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Стадия сбора данных: зарегистрированный коллектор или синтетика.
 */
@Slf4j
public class DataCollectionStage {

    private final TrainingDataCollector fallback;
    private volatile TrainingDataCollector collector;

    public DataCollectionStage(TrainingDataCollector collector, TrainingDataCollector fallback) {
        this.collector = collector;
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public void setCollector(TrainingDataCollector collector) {
        this.collector = collector;
    }

    public List<TrainingSample> collect(RetrainableModelType type, DataCollectionPolicy policy) {
        TrainingDataCollector c = collector != null ? collector : fallback;
        List<TrainingSample> samples = c.collect(type, policy);
        List<TrainingSample> result = samples != null ? samples : List.of();

        log.info("📥 DATA type={} samples={} source={}", type, result.size(), c.getClass().getSimpleName());
        return result;
    }
}
