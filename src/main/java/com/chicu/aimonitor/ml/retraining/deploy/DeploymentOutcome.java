package com.chicu.aimonitor.ml.retraining.deploy;

import com.chicu.aimonitor.ml.retraining.model.DeploymentResult;

/**
 * @param failureReason причина неуспеха от деплоера (может быть null)
 */
public record DeploymentOutcome(
        boolean healthy,
        String failureReason,
        DeploymentResult.HealthCheck healthCheck
) {

    public static DeploymentOutcome healthy(DeploymentResult.HealthCheck hc) {
        return new DeploymentOutcome(true, null, hc);
    }

    public static DeploymentOutcome unhealthy(String reason, DeploymentResult.HealthCheck hc) {
        return new DeploymentOutcome(false, reason, hc);
    }
}
