package com.chicu.aimonitor.ml.retraining.deploy;

import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;

public interface ModelDeployer {

    /**
     * Выкатывает новую модель по стратегии политики и возвращает итог health check.
     * Исключение = сбой стадии (задача уйдёт в FAILED).
     */
    DeploymentOutcome deploy(RetrainableModelType modelType,
                             String newModelId,
                             String previousModelId,
                             DeploymentPolicy policy);
}
