package com.chicu.aimonitor.ml.retraining.data;

import com.chicu.aimonitor.ml.retraining.model.DataCollectionPolicy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import com.chicu.aimonitor.ml.retraining.model.TrainingSample;

import java.util.List;

/**
 * Адаптер к реальному источнику обучающих данных (БД / стрим / кэш).
 * Если бина нет, оркестратор берёт {@link SyntheticTrainingDataCollector}.
 */
public interface TrainingDataCollector {

    List<TrainingSample> collect(RetrainableModelType modelType, DataCollectionPolicy policy);
}
