package com.chicu.aimonitor.ml.retraining.deploy;

import com.chicu.aimonitor.ml.retraining.model.DeploymentPolicy;
import com.chicu.aimonitor.ml.retraining.model.DeploymentResult;
import com.chicu.aimonitor.ml.retraining.model.RetrainableModelType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;

/**
 * Стадия деплоя. Неуспешный health check + autoRollback = откат,
 * без autoRollback = просто неуспех.
 */
@Slf4j
public class DeploymentStage {

    public static final String DEFAULT_ROLLBACK_REASON = "Health check failed after deployment";

    private final ModelDeployer fallback;
    private final Clock clock;
    private volatile ModelDeployer deployer;

    public DeploymentStage(ModelDeployer deployer, ModelDeployer fallback, Clock clock) {
        this.deployer = deployer;
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.clock = clock;
    }

    public void setDeployer(ModelDeployer deployer) {
        this.deployer = deployer;
    }

    public DeploymentResult deploy(RetrainableModelType type,
                                   String newModelId,
                                   String previousModelId,
                                   DeploymentPolicy policy) {

        ModelDeployer d = deployer != null ? deployer : fallback;
        DeploymentOutcome outcome = d.deploy(type, newModelId, previousModelId, policy);
        if (outcome == null) {
            throw new IllegalStateException("Deployer returned no outcome for " + newModelId);
        }

        boolean success = outcome.healthy();
        boolean rolledBack = !success && policy.isAutoRollback();
        String rollbackReason = null;
        if (rolledBack) {
            rollbackReason = outcome.failureReason() != null && !outcome.failureReason().isBlank()
                    ? outcome.failureReason()
                    : DEFAULT_ROLLBACK_REASON;
        }

        if (success) {
            log.info("🚀 DEPLOYED type={} modelId={} prev={} strategy={}",
                    type, newModelId, previousModelId, policy.strategy());
        } else if (rolledBack) {
            log.warn("↩️ ROLLBACK type={} modelId={} -> prev={} reason={}",
                    type, newModelId, previousModelId, rollbackReason);
        } else {
            log.warn("❌ DEPLOY FAILED type={} modelId={} (autoRollback=false)", type, newModelId);
        }

        return DeploymentResult.builder()
                .strategy(policy.strategy())
                .success(success)
                .deployedModelId(newModelId)
                .previousModelId(previousModelId)
                .deployedAt(clock.instant())
                .rolledBack(rolledBack)
                .rollbackReason(rollbackReason)
                .healthCheck(outcome.healthCheck())
                .build();
    }
}
