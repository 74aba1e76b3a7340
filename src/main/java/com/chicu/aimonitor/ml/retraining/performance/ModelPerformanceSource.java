package com.chicu.aimonitor.ml.retraining.performance;

import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;

import java.util.OptionalDouble;

/**
 * Источник текущей (боевой) точности модели.
 * Пустой результат = данных нет, оркестратор подставит симуляцию.
 */
@FunctionalInterface
public interface ModelPerformanceSource {

    OptionalDouble accuracyOf(RetrainableModelType modelType);
}
