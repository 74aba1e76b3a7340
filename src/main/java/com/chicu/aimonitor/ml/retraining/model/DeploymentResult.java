package com.chicu.aimonitor.ml.retraining.model;

import lombok.Builder;

import java.time.Instant;

@Builder
public record DeploymentResult(
        DeploymentStrategy strategy,
        boolean success,
        String deployedModelId,
        String previousModelId,
        Instant deployedAt,
        boolean rolledBack,
        String rollbackReason,
        HealthCheck healthCheck
) {

    /** Снимок post-deploy health check */
    @Builder
    public record HealthCheck(
            boolean healthy,
            double latencyMs,
            double errorRate
    ) {}
}
