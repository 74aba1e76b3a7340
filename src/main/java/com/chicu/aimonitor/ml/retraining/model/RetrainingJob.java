package com.chicu.aimonitor.ml.retraining.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Одна попытка переобучить и (условно) задеплоить модель.
 *
 * Меняется только оркестратором под монитором самого объекта и только пока статус
 * не терминальный. Наружу отдаются копии через {@link #snapshot()}.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"jobId", "status", "progress", "stageMessage"})
public class RetrainingJob {

    private String jobId;
    private RetrainingJobConfig config;

    private RetrainingJobStatus status;
    private int progress;
    private String stageMessage;

    private String previousModelId;
    private String newModelId;

    private TrainingMetrics trainingMetrics;
    private ValidationResult validationResult;
    private DeploymentResult deploymentResult;

    private String error;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public RetrainableModelType getModelType() {
        return config != null ? config.modelType() : null;
    }

    public synchronized RetrainingJob snapshot() {
        return toBuilder().build();
    }
}
